package com.volumemonitor.event;

import java.util.Set;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a symbol is added to or removed from the persisted watchlist.
 * Carries the full list as it now stands.
 *
 * <p>Key listener: MonitoringService, which hands the list to a running engine when the
 * current run follows the watchlist.
 */
public class WatchlistChangedEvent extends ApplicationEvent {

    private final Set<String> symbols;

    public WatchlistChangedEvent(Object source, Set<String> symbols) {
        super(source);
        this.symbols = Set.copyOf(symbols);
    }

    public Set<String> getSymbols() {
        return symbols;
    }
}
