package com.volumemonitor.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.volumemonitor.broker.CredentialProvider;
import com.volumemonitor.broker.KiteAuthService;
import com.volumemonitor.broker.QuoteSource;
import com.volumemonitor.calendar.MarketCalendar;
import com.volumemonitor.config.MonitorProperties;
import com.volumemonitor.core.engine.AlertEvaluator;
import com.volumemonitor.core.engine.PollingEngine;
import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.enums.AlertSeverity;
import com.volumemonitor.domain.enums.InstrumentType;
import com.volumemonitor.domain.enums.MonitoringStatus;
import com.volumemonitor.domain.model.InstrumentRef;
import com.volumemonitor.domain.model.QuoteSnapshot;
import com.volumemonitor.entity.AlertLogEntity;
import com.volumemonitor.entity.VolumeLogEntity;
import com.volumemonitor.event.AlertTriggeredEvent;
import com.volumemonitor.event.MonitoringBatchEvent;
import com.volumemonitor.event.MonitoringErrorEvent;
import com.volumemonitor.event.MonitoringEventPublisher;
import com.volumemonitor.event.MonitoringStatusEvent;
import com.volumemonitor.exception.AuthException;
import com.volumemonitor.notification.AlertMessageFormatter;
import com.volumemonitor.notification.AlertNotificationService;
import com.volumemonitor.notification.TelegramNotifier;
import com.volumemonitor.observability.MonitoringMetrics;
import com.volumemonitor.repository.jpa.AlertLogJpaRepository;
import com.volumemonitor.repository.jpa.VolumeLogJpaRepository;
import com.volumemonitor.service.InstrumentResolver;
import com.volumemonitor.service.MonitoringLogService;
import com.volumemonitor.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Cross-service integration test for the monitoring pipeline.
 * Wires a real PollingEngine + AlertEvaluator + MonitoringEventPublisher and dispatches the
 * published events synchronously to MonitoringLogService, AlertNotificationService and
 * MonitoringMetrics: tick -> evaluate -> publish -> persist / notify / count.
 */
@ExtendWith(MockitoExtension.class)
class MonitoringFlowIntegrationTest {

    private static final ThreadFactory NO_LOOP = runnable -> new Thread(() -> { });

    private static final InstrumentRef RELIANCE = InstrumentRef.builder()
            .symbol("RELIANCE")
            .name("RELIANCE INDUSTRIES")
            .instrumentType(InstrumentType.EQ)
            .exchange("NSE")
            .token(738561L)
            .lotSize(1)
            .build();

    @Mock
    private InstrumentResolver instrumentResolver;

    @Mock
    private QuoteSource quoteSource;

    @Mock
    private MarketCalendar marketCalendar;

    @Mock
    private CredentialProvider credentialProvider;

    @Mock
    private VolumeLogJpaRepository volumeLogJpaRepository;

    @Mock
    private AlertLogJpaRepository alertLogJpaRepository;

    @Mock
    private TelegramNotifier telegramNotifier;

    @Mock
    private SimpMessagingTemplate simpMessagingTemplate;

    @Mock
    private KiteAuthService kiteAuthService;

    private final List<Object> published = new ArrayList<>();
    private final Map<Long, long[]> books = new HashMap<>();
    private final AtomicLong volumeLogIds = new AtomicLong(100);

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private PollingEngine pollingEngine;
    private MonitoringLogService monitoringLogService;
    private AlertNotificationService alertNotificationService;
    private MonitoringMetrics monitoringMetrics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(LocalDateTime.of(2026, 10, 19, 10, 0));
        meterRegistry = new SimpleMeterRegistry();

        ApplicationEventPublisher dispatcher = this::dispatch;
        MonitoringEventPublisher eventPublisher = new MonitoringEventPublisher(dispatcher, clock);
        pollingEngine = new PollingEngine(
                instrumentResolver,
                quoteSource,
                marketCalendar,
                credentialProvider,
                new AlertEvaluator(),
                eventPublisher,
                new MonitorProperties(),
                clock,
                NO_LOOP);

        monitoringLogService = new MonitoringLogService(volumeLogJpaRepository, alertLogJpaRepository, clock);
        alertNotificationService =
                new AlertNotificationService(telegramNotifier, new AlertMessageFormatter(), simpMessagingTemplate);
        monitoringMetrics = new MonitoringMetrics(meterRegistry, pollingEngine, kiteAuthService);

        lenient().when(credentialProvider.currentToken()).thenReturn(Optional.of("access-token"));
        lenient().when(marketCalendar.isOpen(any())).thenReturn(true);
        lenient().when(marketCalendar.isSessionOver(any())).thenReturn(false);
        lenient().when(instrumentResolver.resolve("RELIANCE")).thenReturn(Optional.of(RELIANCE));
        lenient().when(quoteSource.fetchBatch(anyList())).thenAnswer(invocation -> {
            List<InstrumentRef> batch = invocation.getArgument(0);
            Map<Long, QuoteSnapshot> quotes = new HashMap<>();
            for (InstrumentRef ref : batch) {
                long[] book = books.get(ref.getToken());
                if (book != null) {
                    quotes.put(ref.getToken(), snapshot(ref.getToken(), book[0], book[1]));
                }
            }
            return quotes;
        });
        lenient().when(volumeLogJpaRepository.save(any(VolumeLogEntity.class))).thenAnswer(invocation -> {
            VolumeLogEntity entity = invocation.getArgument(0);
            entity.setId(volumeLogIds.incrementAndGet());
            return entity;
        });
        lenient().when(alertLogJpaRepository.save(any(AlertLogEntity.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @AfterEach
    void tearDown() {
        pollingEngine.stop();
    }

    /** Synchronous stand-in for Spring's multicaster, in the listeners' registration order. */
    private void dispatch(Object event) {
        published.add(event);
        if (event instanceof MonitoringBatchEvent batch) {
            monitoringMetrics.onBatch(batch);
            monitoringLogService.onBatch(batch);
        } else if (event instanceof AlertTriggeredEvent alert) {
            monitoringMetrics.onAlert(alert);
            alertNotificationService.onAlert(alert);
        } else if (event instanceof MonitoringErrorEvent error) {
            monitoringMetrics.onError(error);
            alertNotificationService.onError(error);
        }
    }

    private static QuoteSnapshot snapshot(long token, long buy, long sell) {
        return QuoteSnapshot.builder()
                .token(token)
                .lastPrice(new BigDecimal("2925.40"))
                .buyQuantity(buy)
                .sellQuantity(sell)
                .open(new BigDecimal("2900.00"))
                .high(new BigDecimal("2950.50"))
                .low(new BigDecimal("2880.25"))
                .close(new BigDecimal("2890.00"))
                .build();
    }

    private <T> List<T> publishedOf(Class<T> type) {
        return published.stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Test
    @DisplayName("A TBQ spike flows through to the log, the notifier, the stream and the metrics")
    void spikeFlowsToEveryConsumer() {
        pollingEngine.start(Set.of("RELIANCE"));
        books.put(RELIANCE.getToken(), new long[] {100000, 100000});
        pollingEngine.runTick();

        clock.advanceSeconds(5);
        books.put(RELIANCE.getToken(), new long[] {110000, 100000});
        pollingEngine.runTick();

        assertThat(publishedOf(MonitoringStatusEvent.class))
                .extracting(MonitoringStatusEvent::getStatus)
                .containsExactly(MonitoringStatus.RUNNING);
        assertThat(publishedOf(MonitoringBatchEvent.class)).hasSize(2);
        assertThat(publishedOf(AlertTriggeredEvent.class))
                .singleElement()
                .satisfies(alert -> {
                    assertThat(alert.getSymbol()).isEqualTo("RELIANCE");
                    assertThat(alert.getAlertKind()).isEqualTo(AlertKind.BUY_SPIKE);
                    assertThat(alert.getResult().getBuyChangePercent()).isEqualTo(0.10, within(1e-9));
                });

        ArgumentCaptor<VolumeLogEntity> volumeRows = ArgumentCaptor.forClass(VolumeLogEntity.class);
        verify(volumeLogJpaRepository, times(2)).save(volumeRows.capture());
        assertThat(volumeRows.getAllValues())
                .extracting(VolumeLogEntity::isAlertTriggered)
                .containsExactly(false, true);

        ArgumentCaptor<AlertLogEntity> alertRow = ArgumentCaptor.forClass(AlertLogEntity.class);
        verify(alertLogJpaRepository).save(alertRow.capture());
        assertThat(alertRow.getValue().getAlertKind()).isEqualTo(AlertKind.BUY_SPIKE);
        assertThat(alertRow.getValue().getMessage()).isEqualTo("TBQ Spike");
        assertThat(alertRow.getValue().getVolumeLogId()).isEqualTo(102L);

        verify(telegramNotifier).send(contains("ALERT! RELIANCE - EQ - TBQ Spike"), eq(AlertSeverity.WARNING));
        verify(simpMessagingTemplate).convertAndSend(eq("/topic/alerts"), any(Object.class));

        assertThat(meterRegistry.get("monitor.ticks").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("monitor.alerts").tag("kind", "BUY_SPIKE").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("monitor.tracked.symbols").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A second spike inside the cooldown is logged but not alerted")
    void cooldownSuppressesRepeatAlert() {
        pollingEngine.start(Set.of("RELIANCE"));
        books.put(RELIANCE.getToken(), new long[] {100000, 100000});
        pollingEngine.runTick();

        clock.advanceSeconds(5);
        books.put(RELIANCE.getToken(), new long[] {110000, 100000});
        pollingEngine.runTick();

        clock.advanceSeconds(5);
        books.put(RELIANCE.getToken(), new long[] {120000, 100000});
        pollingEngine.runTick();

        assertThat(publishedOf(MonitoringBatchEvent.class)).hasSize(3);
        assertThat(publishedOf(AlertTriggeredEvent.class)).hasSize(1);
        verify(volumeLogJpaRepository, times(3)).save(any(VolumeLogEntity.class));
        verify(alertLogJpaRepository, times(1)).save(any(AlertLogEntity.class));
        verify(telegramNotifier, times(1)).send(any(), eq(AlertSeverity.WARNING));
    }

    @Test
    @DisplayName("An expired broker session stops monitoring and raises a critical notification")
    void authFailureStopsMonitoring() {
        pollingEngine.start(Set.of("RELIANCE"));
        when(quoteSource.fetchBatch(anyList())).thenThrow(new AuthException("Token expired"));

        pollingEngine.runTick();

        assertThat(pollingEngine.getStatus()).isEqualTo(MonitoringStatus.STOPPED);
        assertThat(publishedOf(MonitoringBatchEvent.class)).isEmpty();
        assertThat(publishedOf(MonitoringStatusEvent.class))
                .extracting(MonitoringStatusEvent::getStatus)
                .containsExactly(MonitoringStatus.RUNNING, MonitoringStatus.STOPPED);

        verify(telegramNotifier).send(contains("Monitoring stopped"), eq(AlertSeverity.CRITICAL));
        verify(volumeLogJpaRepository, never()).save(any(VolumeLogEntity.class));
        assertThat(meterRegistry.get("monitor.fatal.errors").counter().count()).isEqualTo(1.0);
    }
}
