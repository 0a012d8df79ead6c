package com.volumemonitor.event;

import com.volumemonitor.core.engine.MonitoringListener;
import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.enums.ErrorScope;
import com.volumemonitor.domain.enums.MonitoringStatus;
import com.volumemonitor.domain.model.SymbolResult;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Bridges the polling engine's callbacks onto Spring's {@link ApplicationEventPublisher}.
 *
 * <p>The engine stays unaware of Spring events; every consumer (persistence, notification,
 * streaming, metrics, auto-trade) subscribes with {@code @EventListener} instead of
 * registering with the engine. Delivery runs on the polling thread, so slow consumers
 * are {@code @Async}.
 */
@Component
public class MonitoringEventPublisher implements MonitoringListener {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public MonitoringEventPublisher(ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    @Override
    public void onBatchResult(List<SymbolResult> results) {
        applicationEventPublisher.publishEvent(new MonitoringBatchEvent(this, results));
    }

    @Override
    public void onAlert(String symbol, AlertKind alertKind, SymbolResult result) {
        applicationEventPublisher.publishEvent(new AlertTriggeredEvent(this, symbol, alertKind, result));
    }

    @Override
    public void onStatusChanged(MonitoringStatus status) {
        applicationEventPublisher.publishEvent(new MonitoringStatusEvent(this, status, LocalDateTime.now(clock)));
    }

    @Override
    public void onError(ErrorScope scope, String message) {
        applicationEventPublisher.publishEvent(
                new MonitoringErrorEvent(this, scope, message, LocalDateTime.now(clock)));
    }
}
