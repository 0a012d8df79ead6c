package com.volumemonitor.service;

import com.volumemonitor.domain.enums.InstrumentType;
import com.volumemonitor.domain.enums.MarketPhase;
import com.volumemonitor.domain.model.InstrumentRef;
import com.volumemonitor.entity.InstrumentEntity;
import com.volumemonitor.event.MarketStatusEvent;
import com.volumemonitor.event.SessionEvent;
import com.volumemonitor.exception.BrokerException;
import com.volumemonitor.mapper.InstrumentMapper;
import com.volumemonitor.repository.jpa.InstrumentJpaRepository;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Manages the daily instrument catalog: loading from H2 or downloading from Kite API,
 * caching in memory, and resolving watchlist symbols to instruments.
 *
 * <p>Downloads from two exchanges once per day:
 * <ul>
 *   <li>NSE: cash-market equities (EQ). Indices are skipped, they have no order book.</li>
 *   <li>NFO: futures and options (FUT/CE/PE).</li>
 * </ul>
 *
 * <p>Lookups are served from a symbol-keyed in-memory map replaced wholesale on every load,
 * so {@link #resolve(String)} never touches the network. When the same trading symbol exists on
 * both exchanges, the NSE instrument wins.
 */
@Service
public class InstrumentService implements InstrumentResolver {

    private static final Logger log = LoggerFactory.getLogger(InstrumentService.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    /** Exchanges to download, in priority order for duplicate symbols. */
    private static final List<String> EXCHANGES = List.of("NSE", "NFO");

    private static final int SEARCH_LIMIT = 50;

    private final InstrumentJpaRepository instrumentJpaRepository;
    private final InstrumentMapper instrumentMapper;
    private final KiteConnect kiteConnect;
    private final Clock clock;

    private volatile Map<String, InstrumentRef> symbolCache = Map.of();
    private volatile LocalDate loadedDate;

    public InstrumentService(
            InstrumentJpaRepository instrumentJpaRepository,
            InstrumentMapper instrumentMapper,
            KiteConnect kiteConnect,
            Clock clock) {
        this.instrumentJpaRepository = instrumentJpaRepository;
        this.instrumentMapper = instrumentMapper;
        this.kiteConnect = kiteConnect;
        this.clock = clock;
    }

    /**
     * Loads today's instruments into memory. Requires a valid Kite session when today's
     * catalog is not in H2 yet.
     *
     * @throws BrokerException if the Kite API download fails
     */
    public void loadInstruments() {
        LocalDate today = LocalDate.now(clock);

        if (instrumentJpaRepository.existsByDownloadDate(today)) {
            log.info("Instruments for today ({}) found in H2, loading from DB...", today);
            List<InstrumentRef> instruments =
                    instrumentMapper.toDomainList(instrumentJpaRepository.findByDownloadDate(today));
            populateCache(instruments, today);
            return;
        }

        log.info("No instruments in H2 for today ({}), downloading from Kite API...", today);
        downloadAndSave(today);
    }

    /**
     * Re-downloads today's catalog regardless of what H2 holds.
     *
     * @return number of instruments cached after the refresh
     * @throws BrokerException if the Kite API download fails
     */
    public int refreshInstruments() {
        downloadAndSave(LocalDate.now(clock));
        return symbolCache.size();
    }

    @Override
    public Optional<InstrumentRef> resolve(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(symbolCache.get(normalize(symbol)));
    }

    /**
     * Searches the catalog by symbol prefix or name (case-insensitive), optionally filtered by type.
     * Scans the whole cache; intended for UI search, not the polling path.
     *
     * @param query the search term
     * @param type optional instrument type filter, null for all
     * @return up to 50 matches, shortest symbols first
     */
    public List<InstrumentRef> search(String query, InstrumentType type) {
        String upperQuery = normalize(query);
        return symbolCache.values().stream()
                .filter(i -> type == null || type == i.getInstrumentType())
                .filter(i -> matchesSearch(i, upperQuery))
                .sorted(Comparator.comparingInt((InstrumentRef i) -> i.getSymbol().length())
                        .thenComparing(InstrumentRef::getSymbol))
                .limit(SEARCH_LIMIT)
                .toList();
    }

    public int getCachedInstrumentCount() {
        return symbolCache.size();
    }

    public Optional<LocalDate> getLoadedDate() {
        return Optional.ofNullable(loadedDate);
    }

    /**
     * Refreshes a stale catalog when the market enters pre-open on a new day.
     * Failures are logged; yesterday's catalog stays in use until a refresh succeeds.
     */
    @EventListener
    public void onMarketStatus(MarketStatusEvent event) {
        if (event.getCurrentPhase() != MarketPhase.PRE_OPEN) {
            return;
        }
        LocalDate today = LocalDate.now(clock);
        if (today.equals(loadedDate)) {
            return;
        }
        try {
            loadInstruments();
        } catch (BrokerException e) {
            log.warn("Pre-open instrument refresh failed, keeping catalog from {}: {}", loadedDate, e.getMessage());
        }
    }

    /**
     * Loads the catalog as soon as a Kite session becomes available, unless today's is already cached.
     */
    @Async("eventExecutor")
    @EventListener
    public void onSession(SessionEvent event) {
        if (!event.isAuthenticated() || LocalDate.now(clock).equals(loadedDate)) {
            return;
        }
        try {
            loadInstruments();
        } catch (BrokerException e) {
            log.error("Failed to load instruments after {}: {}", event.getEventType(), e.getMessage());
        }
    }

    // ---- Private helpers ----

    private boolean matchesSearch(InstrumentRef instrument, String upperQuery) {
        String name = instrument.getName();
        return instrument.getSymbol().startsWith(upperQuery)
                || (name != null && name.toUpperCase(Locale.ROOT).contains(upperQuery));
    }

    private void downloadAndSave(LocalDate today) {
        List<InstrumentRef> allInstruments = new ArrayList<>();
        try {
            for (String exchange : EXCHANGES) {
                List<com.zerodhatech.models.Instrument> kiteInstruments = kiteConnect.getInstruments(exchange);
                List<InstrumentRef> instruments = kiteInstruments.stream()
                        .filter(ki -> !"INDICES".equals(ki.segment))
                        .map(this::mapFromKite)
                        .filter(i -> i.getInstrumentType() != null)
                        .toList();
                log.info(
                        "Downloaded {} {} instruments from Kite API, {} monitorable",
                        kiteInstruments.size(),
                        exchange,
                        instruments.size());
                allInstruments.addAll(instruments);
            }
        } catch (KiteException e) {
            throw new BrokerException("Failed to download instruments from Kite API: " + e.message, e);
        } catch (JSONException | IOException e) {
            throw new BrokerException("Failed to download instruments from Kite API: " + e.getMessage(), e);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<InstrumentEntity> entities = allInstruments.stream()
                .map(instrumentMapper::toEntity)
                .toList();
        entities.forEach(e -> {
            e.setDownloadDate(today);
            e.setCreatedAt(now);
        });

        // only today's instruments are needed
        instrumentJpaRepository.deleteAllInBatch();
        instrumentJpaRepository.saveAll(entities);
        log.info("Saved {} instruments to H2 for date {}", entities.size(), today);

        populateCache(allInstruments, today);
    }

    private void populateCache(List<InstrumentRef> instruments, LocalDate date) {
        Map<String, InstrumentRef> cache = new HashMap<>(instruments.size() * 2);
        for (InstrumentRef instrument : instruments) {
            if (instrument.getInstrumentType() == null || instrument.getSymbol() == null) {
                continue;
            }
            String key = normalize(instrument.getSymbol());
            InstrumentRef existing = cache.get(key);
            if (existing == null || ("NFO".equals(existing.getExchange()) && "NSE".equals(instrument.getExchange()))) {
                cache.put(key, instrument);
            }
        }
        this.symbolCache = Map.copyOf(cache);
        this.loadedDate = date;
        log.info("Instrument cache populated: {} symbols for {}", cache.size(), date);
    }

    /**
     * Maps a Kite SDK Instrument to an {@link InstrumentRef}. Types outside EQ/FUT/CE/PE
     * map to a null type and are dropped by the caller.
     */
    private InstrumentRef mapFromKite(com.zerodhatech.models.Instrument kiteInstrument) {
        return InstrumentRef.builder()
                .symbol(kiteInstrument.tradingsymbol)
                .name(kiteInstrument.name)
                .instrumentType(parseInstrumentType(kiteInstrument.instrument_type))
                .exchange(kiteInstrument.exchange)
                .token(kiteInstrument.instrument_token)
                .expiry(convertToLocalDate(kiteInstrument.expiry))
                .strike(parseStrike(kiteInstrument.strike))
                .lotSize(kiteInstrument.lot_size)
                .build();
    }

    private InstrumentType parseInstrumentType(String kiteType) {
        if (kiteType == null || kiteType.isBlank()) {
            return null;
        }
        try {
            return InstrumentType.valueOf(kiteType);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Parses Kite's strike field (String) to BigDecimal.
     * Returns null for empty, unparseable, or zero strikes (equities and futures carry "0").
     */
    private BigDecimal parseStrike(String strike) {
        if (strike == null || strike.isBlank()) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(strike);
            return value.signum() == 0 ? null : value;
        } catch (NumberFormatException e) {
            log.warn("Could not parse strike value: {}", strike);
            return null;
        }
    }

    /** Converts Kite's java.util.Date expiry to LocalDate. Returns null if input is null. */
    private LocalDate convertToLocalDate(java.util.Date date) {
        if (date == null) {
            return null;
        }
        return date.toInstant().atZone(IST).toLocalDate();
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
