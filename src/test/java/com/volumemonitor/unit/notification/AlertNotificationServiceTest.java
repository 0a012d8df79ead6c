package com.volumemonitor.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.enums.AlertSeverity;
import com.volumemonitor.domain.enums.ErrorScope;
import com.volumemonitor.event.AlertTriggeredEvent;
import com.volumemonitor.event.MonitoringErrorEvent;
import com.volumemonitor.notification.AlertMessageFormatter;
import com.volumemonitor.notification.AlertNotificationService;
import com.volumemonitor.notification.TelegramNotifier;
import com.volumemonitor.support.SymbolResults;
import java.time.LocalDateTime;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Unit tests for AlertNotificationService.
 */
@ExtendWith(MockitoExtension.class)
class AlertNotificationServiceTest {

    @Mock
    private TelegramNotifier telegramNotifier;

    @Mock
    private SimpMessagingTemplate simpMessagingTemplate;

    private AlertNotificationService alertNotificationService;

    @BeforeEach
    void setUp() {
        alertNotificationService =
                new AlertNotificationService(telegramNotifier, new AlertMessageFormatter(), simpMessagingTemplate);
    }

    @Test
    @SuppressWarnings("unchecked")
    void onAlert_sendsTelegramAndPushesToAlertsTopic() {
        alertNotificationService.onAlert(new AlertTriggeredEvent(
                this, "RELIANCE", AlertKind.SELL_SPIKE, SymbolResults.reliance(AlertKind.SELL_SPIKE)));

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(telegramNotifier).send(text.capture(), eq(AlertSeverity.WARNING));
        assertThat(text.getValue()).contains("ALERT! RELIANCE - EQ - TSQ Spike");

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(simpMessagingTemplate).convertAndSend(eq("/topic/alerts"), payload.capture());
        assertThat((Map<String, Object>) payload.getValue())
                .containsEntry("symbol", "RELIANCE")
                .containsEntry("alertKind", "SELL_SPIKE")
                .containsEntry("label", "TSQ Spike")
                .containsEntry("message", text.getValue());
    }

    @Test
    void onAlert_pushFailureStillSendsTelegram() {
        doThrow(new MessageDeliveryException("broker down"))
                .when(simpMessagingTemplate)
                .convertAndSend(anyString(), any(Object.class));

        alertNotificationService.onAlert(new AlertTriggeredEvent(
                this, "RELIANCE", AlertKind.BUY_SPIKE, SymbolResults.reliance(AlertKind.BUY_SPIKE)));

        verify(telegramNotifier).send(anyString(), eq(AlertSeverity.WARNING));
    }

    @Test
    void onError_fatalSendsCritical() {
        alertNotificationService.onError(new MonitoringErrorEvent(
                this, ErrorScope.FATAL, "Broker session invalid: token expired", LocalDateTime.of(2026, 10, 19, 11, 0)));

        verify(telegramNotifier).send("⚠️ Monitoring stopped: Broker session invalid: token expired", AlertSeverity.CRITICAL);
    }

    @Test
    void onError_batchIsNotNotified() {
        alertNotificationService.onError(new MonitoringErrorEvent(
                this, ErrorScope.BATCH, "Quote batch of 200 failed", LocalDateTime.of(2026, 10, 19, 11, 0)));

        verify(telegramNotifier, never()).send(anyString(), any());
    }
}
