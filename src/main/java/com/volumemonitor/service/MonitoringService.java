package com.volumemonitor.service;

import com.volumemonitor.core.engine.PollingEngine;
import com.volumemonitor.domain.enums.MonitoringStatus;
import com.volumemonitor.event.SessionEvent;
import com.volumemonitor.event.SessionEventType;
import com.volumemonitor.event.WatchlistChangedEvent;
import com.volumemonitor.exception.EngineStateException;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Operator-facing control of the polling engine.
 *
 * <p>Starts monitoring either the persisted watchlist or one explicitly chosen symbol, and
 * rejects pause/resume requests that make no sense for the engine's current state. Watchlist
 * edits reach the engine only while it runs on the watchlist; a single-symbol run keeps its
 * symbol. Monitoring stops automatically when the broker session is logged out.
 */
@Service
public class MonitoringService {

    private static final Logger log = LoggerFactory.getLogger(MonitoringService.class);

    private final PollingEngine pollingEngine;
    private final WatchlistService watchlistService;

    private volatile boolean followsWatchlist;

    public MonitoringService(PollingEngine pollingEngine, WatchlistService watchlistService) {
        this.pollingEngine = pollingEngine;
        this.watchlistService = watchlistService;
    }

    /**
     * @param symbol a single symbol to monitor, or null/blank for the whole watchlist
     * @return the symbols monitoring started with
     */
    public Set<String> start(String symbol) {
        boolean watchlistMode = symbol == null || symbol.isBlank();
        Set<String> symbols = watchlistMode
                ? watchlistService.getSymbols()
                : Set.of(symbol.trim().toUpperCase(Locale.ROOT));
        pollingEngine.start(symbols);
        followsWatchlist = watchlistMode;
        return symbols;
    }

    public void pause() {
        MonitoringStatus status = pollingEngine.getStatus();
        if (status != MonitoringStatus.RUNNING && status != MonitoringStatus.MARKET_CLOSED) {
            throw new EngineStateException("Monitoring can only be paused while running", status);
        }
        pollingEngine.pause();
    }

    public void resume() {
        MonitoringStatus status = pollingEngine.getStatus();
        if (status != MonitoringStatus.PAUSED) {
            throw new EngineStateException("Monitoring is not paused", status);
        }
        pollingEngine.resume();
    }

    /** Idempotent. */
    public void stop() {
        pollingEngine.stop();
    }

    public MonitoringStatus getStatus() {
        return pollingEngine.getStatus();
    }

    @EventListener
    public void onWatchlistChanged(WatchlistChangedEvent event) {
        if (!followsWatchlist || pollingEngine.getStatus() == MonitoringStatus.STOPPED) {
            log.debug("Watchlist changed, engine not following it");
            return;
        }
        pollingEngine.replaceWatchlist(event.getSymbols());
    }

    @EventListener
    public void onSession(SessionEvent event) {
        if (event.getEventType() == SessionEventType.LOGGED_OUT
                && pollingEngine.getStatus() != MonitoringStatus.STOPPED) {
            log.info("Broker session logged out, stopping monitoring");
            pollingEngine.stop();
        }
    }
}
