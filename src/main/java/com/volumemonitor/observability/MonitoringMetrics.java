package com.volumemonitor.observability;

import com.volumemonitor.broker.KiteAuthService;
import com.volumemonitor.core.engine.PollingEngine;
import com.volumemonitor.event.AlertTriggeredEvent;
import com.volumemonitor.event.MonitoringBatchEvent;
import com.volumemonitor.event.MonitoringErrorEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the monitoring engine, exposed through the actuator:
 * <ul>
 *   <li><b>monitor.ticks</b> (counter): evaluated ticks</li>
 *   <li><b>monitor.alerts</b> (counter, tagged by kind): fired alerts</li>
 *   <li><b>monitor.batch.failures</b> (counter): quote batches that failed to fetch</li>
 *   <li><b>monitor.resolve.failures</b> (counter): symbols missing from the instrument catalog</li>
 *   <li><b>monitor.fatal.errors</b> (counter): faults that stopped monitoring</li>
 *   <li><b>monitor.tracked.symbols</b> (gauge): symbols with live signal state</li>
 *   <li><b>kite.session.state</b> (gauge 0/1): whether a Kite access token is held</li>
 * </ul>
 *
 * <p>Gauges are read by Micrometer on scrape; counters are driven by the engine's events.
 */
@Service
public class MonitoringMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter tickCounter;
    private final Counter batchFailureCounter;
    private final Counter resolveFailureCounter;
    private final Counter fatalErrorCounter;

    public MonitoringMetrics(MeterRegistry meterRegistry, PollingEngine pollingEngine, KiteAuthService kiteAuthService) {
        this.meterRegistry = meterRegistry;

        this.tickCounter = Counter.builder("monitor.ticks")
                .description("Ticks that produced a result batch")
                .register(meterRegistry);
        this.batchFailureCounter = Counter.builder("monitor.batch.failures")
                .description("Quote batches that failed to fetch")
                .register(meterRegistry);
        this.resolveFailureCounter = Counter.builder("monitor.resolve.failures")
                .description("Watchlist symbols not found in the instrument catalog")
                .register(meterRegistry);
        this.fatalErrorCounter = Counter.builder("monitor.fatal.errors")
                .description("Faults that stopped monitoring")
                .register(meterRegistry);

        meterRegistry.gauge("monitor.tracked.symbols", pollingEngine, PollingEngine::getTrackedSymbolCount);
        meterRegistry.gauge("kite.session.state", kiteAuthService, service -> service.isAuthenticated() ? 1.0 : 0.0);
    }

    @EventListener
    @Order(20)
    public void onBatch(MonitoringBatchEvent event) {
        tickCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onAlert(AlertTriggeredEvent event) {
        Counter.builder("monitor.alerts")
                .description("Fired order-book alerts")
                .tag("kind", event.getAlertKind().name())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onError(MonitoringErrorEvent event) {
        switch (event.getScope()) {
            case BATCH -> batchFailureCounter.increment();
            case RESOLVE -> resolveFailureCounter.increment();
            case FATAL -> fatalErrorCounter.increment();
        }
    }
}
