package com.volumemonitor.service;

import com.volumemonitor.domain.model.InstrumentRef;
import com.volumemonitor.entity.WatchlistEntryEntity;
import com.volumemonitor.event.WatchlistChangedEvent;
import com.volumemonitor.exception.ResourceNotFoundException;
import com.volumemonitor.exception.ValidationException;
import com.volumemonitor.repository.jpa.WatchlistEntryJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Persisted set of symbols to monitor.
 *
 * <p>Symbols are validated against the instrument catalog before they are stored. Every
 * change is published as a {@link WatchlistChangedEvent}.
 */
@Service
public class WatchlistService {

    private static final Logger log = LoggerFactory.getLogger(WatchlistService.class);

    private final WatchlistEntryJpaRepository watchlistEntryJpaRepository;
    private final InstrumentResolver instrumentResolver;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public WatchlistService(
            WatchlistEntryJpaRepository watchlistEntryJpaRepository,
            InstrumentResolver instrumentResolver,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.watchlistEntryJpaRepository = watchlistEntryJpaRepository;
        this.instrumentResolver = instrumentResolver;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    public List<WatchlistEntryEntity> getEntries() {
        return watchlistEntryJpaRepository.findAllByOrderBySymbolAsc();
    }

    /** Watchlist symbols in alphabetical order. */
    public Set<String> getSymbols() {
        Set<String> symbols = new LinkedHashSet<>();
        getEntries().forEach(entry -> symbols.add(entry.getSymbol()));
        return symbols;
    }

    /**
     * Adds a symbol. Adding a symbol that is already on the watchlist returns the existing entry.
     *
     * @throws ResourceNotFoundException if the symbol is not in today's instrument catalog
     */
    public WatchlistEntryEntity add(String symbol) {
        String normalized = normalize(symbol);
        InstrumentRef instrument = instrumentResolver
                .resolve(normalized)
                .orElseThrow(() -> new ResourceNotFoundException("Instrument", normalized));

        if (watchlistEntryJpaRepository.existsBySymbol(instrument.getSymbol())) {
            log.debug("{} already on the watchlist", instrument.getSymbol());
            return getEntries().stream()
                    .filter(entry -> entry.getSymbol().equals(instrument.getSymbol()))
                    .findFirst()
                    .orElseThrow(() -> new ResourceNotFoundException("Watchlist entry", instrument.getSymbol()));
        }

        WatchlistEntryEntity saved = watchlistEntryJpaRepository.save(WatchlistEntryEntity.builder()
                .symbol(instrument.getSymbol())
                .instrumentType(instrument.getInstrumentType())
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.info("Added {} ({}) to the watchlist", saved.getSymbol(), saved.getInstrumentType());
        publishChange();
        return saved;
    }

    /**
     * @throws ResourceNotFoundException if the symbol is not on the watchlist
     */
    public void remove(String symbol) {
        String normalized = normalize(symbol);
        if (watchlistEntryJpaRepository.deleteBySymbol(normalized) == 0) {
            throw new ResourceNotFoundException("Watchlist entry", normalized);
        }
        log.info("Removed {} from the watchlist", normalized);
        publishChange();
    }

    private void publishChange() {
        applicationEventPublisher.publishEvent(new WatchlistChangedEvent(this, getSymbols()));
    }

    private static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("symbol must not be blank");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
