package com.volumemonitor.core.engine;

import com.volumemonitor.broker.CredentialProvider;
import com.volumemonitor.broker.QuoteSource;
import com.volumemonitor.calendar.MarketCalendar;
import com.volumemonitor.config.MonitorProperties;
import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.enums.ErrorScope;
import com.volumemonitor.domain.enums.MonitoringStatus;
import com.volumemonitor.domain.model.AlertSettings;
import com.volumemonitor.domain.model.EvaluationResult;
import com.volumemonitor.domain.model.InstrumentRef;
import com.volumemonitor.domain.model.QuoteSnapshot;
import com.volumemonitor.domain.model.SymbolResult;
import com.volumemonitor.exception.AuthException;
import com.volumemonitor.exception.ConfigurationException;
import com.volumemonitor.exception.EngineStateException;
import com.volumemonitor.service.InstrumentResolver;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives the fetch, evaluate and emit cycle for the watchlist on a dedicated polling thread.
 *
 * <p>Run control: {@code STOPPED -> RUNNING} on {@link #start(Set)}, {@code RUNNING <-> PAUSED}
 * on {@link #pause()}/{@link #resume()}, {@code RUNNING <-> MARKET_CLOSED} as the market-hours gate
 * closes and reopens, and back to {@code STOPPED} on {@link #stop()}, on session end, or on an
 * authentication failure mid-session.
 *
 * <p>Each tick:
 * <ol>
 *   <li>Day rollover: on a new calendar date every {@link SignalState} is dropped.</li>
 *   <li>Market gate: skip fetching while closed, stop once the session is over.</li>
 *   <li>Resolve the watchlist, reporting unresolvable symbols with {@link ErrorScope#RESOLVE}.</li>
 *   <li>Quote the resolved instruments in batches of {@code monitor.batch-size}. A failed batch is
 *       reported with {@link ErrorScope#BATCH} and the remaining batches still run.</li>
 *   <li>Evaluate every returned snapshot, then emit one batch result followed by one alert
 *       callback per fired alert.</li>
 * </ol>
 *
 * <p>Signal state belongs to the polling thread alone. Each {@link #start(Set)} opens a fresh
 * {@link Session}; {@link #stop()} abandons it, so a tick still in flight past the grace period
 * never emits into the next session.
 */
@Service
public class PollingEngine {

    private static final Logger log = LoggerFactory.getLogger(PollingEngine.class);

    private final InstrumentResolver instrumentResolver;
    private final QuoteSource quoteSource;
    private final MarketCalendar marketCalendar;
    private final CredentialProvider credentialProvider;
    private final AlertEvaluator alertEvaluator;
    private final MonitoringListener listener;
    private final MonitorProperties monitorProperties;
    private final Clock clock;
    private final ThreadFactory threadFactory;

    private final Object lifecycleLock = new Object();
    private final AtomicReference<Set<String>> watchlist = new AtomicReference<>(Set.of());
    private final AtomicLong sessionCounter = new AtomicLong();

    private volatile MonitoringStatus status = MonitoringStatus.STOPPED;
    private volatile Session session;
    private volatile Instant lastTickAt;
    private volatile int trackedSymbolCount;

    public PollingEngine(
            InstrumentResolver instrumentResolver,
            QuoteSource quoteSource,
            MarketCalendar marketCalendar,
            CredentialProvider credentialProvider,
            AlertEvaluator alertEvaluator,
            MonitoringListener listener,
            MonitorProperties monitorProperties,
            Clock clock,
            @Qualifier("pollingThreadFactory") ThreadFactory threadFactory) {
        this.instrumentResolver = instrumentResolver;
        this.quoteSource = quoteSource;
        this.marketCalendar = marketCalendar;
        this.credentialProvider = credentialProvider;
        this.alertEvaluator = alertEvaluator;
        this.listener = listener;
        this.monitorProperties = monitorProperties;
        this.clock = clock;
        this.threadFactory = threadFactory;
    }

    /**
     * Starts monitoring the given symbols with the currently configured thresholds.
     *
     * @throws EngineStateException if the engine is not stopped
     * @throws ConfigurationException on an empty watchlist, invalid settings, an invalid session
     *     window, or when none of the symbols resolves
     * @throws AuthException if there is no broker session
     */
    public void start(Set<String> symbols) {
        synchronized (lifecycleLock) {
            if (status != MonitoringStatus.STOPPED) {
                throw new EngineStateException("Monitoring is already active", status);
            }
            if (symbols == null || symbols.isEmpty()) {
                throw new ConfigurationException("Watchlist is empty: add at least one symbol before starting");
            }

            List<String> violations = monitorProperties.violations();
            if (!violations.isEmpty()) {
                throw new ConfigurationException("Invalid monitoring settings", violations);
            }
            marketCalendar.validateSessionWindow();

            if (credentialProvider.currentToken().isEmpty()) {
                throw new AuthException("No active broker session. Log in before starting monitoring");
            }

            boolean anyResolvable = symbols.stream()
                    .anyMatch(symbol -> instrumentResolver.resolve(symbol).isPresent());
            if (!anyResolvable) {
                throw new ConfigurationException("None of the watchlist symbols could be resolved: " + symbols);
            }

            Session newSession = new Session(
                    sessionCounter.incrementAndGet(),
                    monitorProperties.toAlertSettings(),
                    monitorProperties.getBatchSize(),
                    Duration.ofSeconds(monitorProperties.getPollIntervalSeconds()),
                    Duration.ofSeconds(monitorProperties.getPausedIdleSeconds()));
            watchlist.set(Set.copyOf(symbols));
            session = newSession;
            lastTickAt = null;
            trackedSymbolCount = 0;
            status = MonitoringStatus.RUNNING;

            newSession.thread = threadFactory.newThread(() -> runLoop(newSession));
            newSession.thread.start();

            log.info(
                    "Monitoring started: session={}, symbols={}, interval={}s, batchSize={}, settings={}",
                    newSession.id,
                    symbols.size(),
                    monitorProperties.getPollIntervalSeconds(),
                    newSession.batchSize,
                    newSession.settings);
        }
        notifyStatus(MonitoringStatus.RUNNING);
    }

    /** Suspends fetching without losing signal state. No-op unless running. */
    public void pause() {
        synchronized (lifecycleLock) {
            if (status != MonitoringStatus.RUNNING && status != MonitoringStatus.MARKET_CLOSED) {
                return;
            }
            status = MonitoringStatus.PAUSED;
        }
        log.info("Monitoring paused");
        notifyStatus(MonitoringStatus.PAUSED);
    }

    /** Resumes a paused engine. No-op unless paused. */
    public void resume() {
        synchronized (lifecycleLock) {
            if (status != MonitoringStatus.PAUSED) {
                return;
            }
            status = MonitoringStatus.RUNNING;
            Session current = session;
            if (current != null) {
                current.wake();
            }
        }
        log.info("Monitoring resumed");
        notifyStatus(MonitoringStatus.RUNNING);
    }

    /**
     * Stops monitoring and discards all signal state. Waits up to {@code monitor.stop-grace-seconds}
     * for an in-flight tick, then interrupts the polling thread and returns regardless. A grace of
     * 0 interrupts without waiting.
     * Safe to call at any time, including from a listener callback.
     */
    public void stop() {
        Session stopped = detachSession();
        if (stopped == null) {
            return;
        }

        Thread thread = stopped.thread;
        if (thread != null && thread != Thread.currentThread()) {
            // join(0) waits forever, so a zero grace skips straight to the interrupt
            long graceMillis = TimeUnit.SECONDS.toMillis(monitorProperties.getStopGraceSeconds());
            if (graceMillis > 0) {
                try {
                    thread.join(graceMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (thread.isAlive()) {
                log.warn(
                        "Polling thread {} did not finish within {}s, interrupting",
                        thread.getName(),
                        monitorProperties.getStopGraceSeconds());
                thread.interrupt();
            }
        }

        log.info("Monitoring stopped: session={}", stopped.id);
        notifyStatus(MonitoringStatus.STOPPED);
    }

    /**
     * Replaces the monitored symbol set. The polling thread picks it up at the next tick
     * boundary; state for symbols no longer on the list is discarded there.
     */
    public void replaceWatchlist(Set<String> symbols) {
        Set<String> replacement = symbols == null ? Set.of() : Set.copyOf(symbols);
        watchlist.set(replacement);
        log.info("Watchlist replaced: {} symbols", replacement.size());
    }

    /**
     * Runs one tick of the active session on the calling thread. Does nothing when stopped.
     * The polling loop calls this between sleeps; tests call it to drive ticks deterministically.
     */
    public void runTick() {
        Session current = session;
        if (current != null) {
            runTick(current);
        }
    }

    public MonitoringStatus getStatus() {
        return status;
    }

    public Set<String> getWatchlist() {
        return watchlist.get();
    }

    public int getTrackedSymbolCount() {
        return trackedSymbolCount;
    }

    public Optional<Instant> getLastTickAt() {
        return Optional.ofNullable(lastTickAt);
    }

    /** Settings captured at start for the active session; empty when stopped. */
    public Optional<AlertSettings> getActiveSettings() {
        Session current = session;
        return current == null ? Optional.empty() : Optional.of(current.settings);
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    // ---- polling loop ----

    private void runLoop(Session current) {
        log.info("Polling loop started on {}", Thread.currentThread().getName());
        while (!current.stopRequested) {
            if (status == MonitoringStatus.PAUSED) {
                current.sleep(current.pausedIdle);
                continue;
            }

            Instant tickStart = clock.instant();
            try {
                runTick(current);
            } catch (RuntimeException e) {
                log.error("Unexpected error during tick, continuing with next tick: {}", e.getMessage(), e);
            }

            Duration elapsed = Duration.between(tickStart, clock.instant());
            Duration remaining = current.pollInterval.minus(elapsed);
            if (!remaining.isNegative() && !remaining.isZero()) {
                current.sleep(remaining);
            }
        }
        log.info("Polling loop exited for session {}", current.id);
    }

    private void runTick(Session current) {
        synchronized (current) {
            if (!current.stopRequested) {
                tick(current);
            }
        }
    }

    private void tick(Session current) {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, clock.getZone());

        if (!today.equals(current.lastResetDate)) {
            if (current.lastResetDate != null) {
                log.info("New trading day {}: resetting {} symbol states", today, current.signalStates.size());
            }
            current.signalStates.clear();
            current.lastResetDate = today;
            trackedSymbolCount = 0;
        }

        if (status == MonitoringStatus.PAUSED) {
            return;
        }

        if (marketCalendar.isSessionOver(now)) {
            log.info("Market session is over, stopping monitoring");
            if (detachSession() == current) {
                notifyStatus(MonitoringStatus.STOPPED);
            }
            return;
        }

        if (!marketCalendar.isOpen(now)) {
            if (transition(current, MonitoringStatus.RUNNING, MonitoringStatus.MARKET_CLOSED)) {
                log.info("Market closed, skipping fetch until it reopens");
                notifyStatus(MonitoringStatus.MARKET_CLOSED);
            }
            return;
        }
        if (transition(current, MonitoringStatus.MARKET_CLOSED, MonitoringStatus.RUNNING)) {
            log.info("Market open, resuming fetch");
            notifyStatus(MonitoringStatus.RUNNING);
        }

        Set<String> symbols = watchlist.get();
        current.signalStates.keySet().retainAll(symbols);

        List<InstrumentRef> resolved = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            Optional<InstrumentRef> ref;
            try {
                ref = instrumentResolver.resolve(symbol);
            } catch (RuntimeException e) {
                log.warn("Resolving {} failed: {}", symbol, e.getMessage());
                ref = Optional.empty();
            }
            if (ref.isPresent()) {
                resolved.add(ref.get());
            } else {
                notifyError(ErrorScope.RESOLVE, "Symbol not found in instrument catalog: " + symbol);
            }
        }

        LocalDateTime evaluatedAt = LocalDateTime.ofInstant(now, clock.getZone());
        List<SymbolResult> results = new ArrayList<>(resolved.size());

        for (List<InstrumentRef> batch : partition(resolved, current.batchSize)) {
            if (current.stopRequested) {
                return;
            }

            Map<Long, QuoteSnapshot> quotes;
            try {
                quotes = quoteSource.fetchBatch(batch);
            } catch (AuthException e) {
                log.error("Broker session rejected during tick, stopping monitoring: {}", e.getMessage());
                if (detachSession() == current) {
                    notifyStatus(MonitoringStatus.STOPPED);
                    notifyError(ErrorScope.FATAL, "Broker session invalid: " + e.getMessage());
                }
                return;
            } catch (RuntimeException e) {
                log.warn("Quote batch of {} instruments failed: {}", batch.size(), e.getMessage());
                notifyError(ErrorScope.BATCH, "Quote batch of " + batch.size() + " failed: " + e.getMessage());
                continue;
            }

            for (InstrumentRef ref : batch) {
                QuoteSnapshot snapshot = quotes.get(ref.getToken());
                if (snapshot == null) {
                    continue;
                }
                SignalState state = current.signalStates.computeIfAbsent(ref.getSymbol(), SignalState::new);
                try {
                    EvaluationResult evaluation = alertEvaluator.evaluate(snapshot, state, current.settings, now);
                    results.add(SymbolResult.of(ref, snapshot, evaluation, evaluatedAt));
                } catch (RuntimeException e) {
                    log.warn("Evaluation failed for {}, dropping it from this tick: {}", ref.getSymbol(), e.getMessage(), e);
                }
            }
        }

        if (current.stopRequested) {
            return;
        }

        lastTickAt = now;
        trackedSymbolCount = current.signalStates.size();

        List<SymbolResult> emitted = List.copyOf(results);
        notifyBatch(emitted);
        for (SymbolResult result : emitted) {
            for (AlertKind kind : result.getFiredAlertKinds()) {
                notifyAlert(result.getSymbol(), kind, result);
            }
        }
        log.debug("Tick complete: {} of {} symbols evaluated", emitted.size(), symbols.size());
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            batches.add(List.copyOf(items.subList(i, Math.min(i + size, items.size()))));
        }
        return batches;
    }

    private boolean transition(Session current, MonitoringStatus from, MonitoringStatus to) {
        synchronized (lifecycleLock) {
            if (status != from || session != current) {
                return false;
            }
            status = to;
            return true;
        }
    }

    /** Marks the active session stopped and returns it, or null when nothing was running. */
    private Session detachSession() {
        synchronized (lifecycleLock) {
            Session current = session;
            if (current == null) {
                return null;
            }
            current.stopRequested = true;
            current.wake();
            session = null;
            status = MonitoringStatus.STOPPED;
            trackedSymbolCount = 0;
            return current;
        }
    }

    // ---- listener dispatch: a failing consumer never unwinds the loop ----

    private void notifyBatch(List<SymbolResult> results) {
        try {
            listener.onBatchResult(results);
        } catch (RuntimeException e) {
            log.error("Listener failed handling batch result: {}", e.getMessage(), e);
        }
    }

    private void notifyAlert(String symbol, AlertKind kind, SymbolResult result) {
        try {
            listener.onAlert(symbol, kind, result);
        } catch (RuntimeException e) {
            log.error("Listener failed handling {} alert for {}: {}", kind, symbol, e.getMessage(), e);
        }
    }

    private void notifyStatus(MonitoringStatus newStatus) {
        try {
            listener.onStatusChanged(newStatus);
        } catch (RuntimeException e) {
            log.error("Listener failed handling status {}: {}", newStatus, e.getMessage(), e);
        }
    }

    private void notifyError(ErrorScope scope, String message) {
        try {
            listener.onError(scope, message);
        } catch (RuntimeException e) {
            log.error("Listener failed handling {} error: {}", scope.getWireName(), e.getMessage(), e);
        }
    }

    /**
     * One start-to-stop monitoring run. Owns the signal state map, which only the tick
     * holding this session's monitor touches.
     */
    private static final class Session {

        final long id;
        final AlertSettings settings;
        final int batchSize;
        final Duration pollInterval;
        final Duration pausedIdle;
        final Map<String, SignalState> signalStates = new HashMap<>();

        volatile boolean stopRequested;
        volatile CountDownLatch wakeSignal = new CountDownLatch(1);
        volatile Thread thread;
        LocalDate lastResetDate;

        Session(long id, AlertSettings settings, int batchSize, Duration pollInterval, Duration pausedIdle) {
            this.id = id;
            this.settings = settings;
            this.batchSize = batchSize;
            this.pollInterval = pollInterval;
            this.pausedIdle = pausedIdle;
        }

        /** Sleeps for the duration or until stopped or resumed. */
        void sleep(Duration duration) {
            CountDownLatch latch = wakeSignal;
            try {
                latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopRequested = true;
            }
            if (latch.getCount() == 0 && !stopRequested) {
                wakeSignal = new CountDownLatch(1);
            }
        }

        void wake() {
            wakeSignal.countDown();
        }
    }
}
