package com.volumemonitor.notification;

import com.volumemonitor.domain.enums.AlertSeverity;
import com.volumemonitor.domain.enums.ErrorScope;
import com.volumemonitor.domain.model.SymbolResult;
import com.volumemonitor.event.AlertTriggeredEvent;
import com.volumemonitor.event.MonitoringErrorEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Delivers alerts to the operator: Telegram (when configured) and the in-app
 * {@code /topic/alerts} STOMP channel.
 *
 * <p>A fatal monitoring error is also sent to Telegram as CRITICAL, since it means monitoring
 * has stopped and nobody is watching the order book any more.
 */
@Service
public class AlertNotificationService {

    private static final Logger log = LoggerFactory.getLogger(AlertNotificationService.class);

    static final String ALERTS_TOPIC = "/topic/alerts";

    private final TelegramNotifier telegramNotifier;
    private final AlertMessageFormatter alertMessageFormatter;
    private final SimpMessagingTemplate simpMessagingTemplate;

    public AlertNotificationService(
            TelegramNotifier telegramNotifier,
            AlertMessageFormatter alertMessageFormatter,
            SimpMessagingTemplate simpMessagingTemplate) {
        this.telegramNotifier = telegramNotifier;
        this.alertMessageFormatter = alertMessageFormatter;
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    @Async("eventExecutor")
    @EventListener
    public void onAlert(AlertTriggeredEvent event) {
        SymbolResult result = event.getResult();
        String text = alertMessageFormatter.format(event.getAlertKind(), result);
        log.info("Alert {} on {} (ratio {})", event.getAlertKind(), event.getSymbol(), result.getRatio());

        telegramNotifier.send(text, AlertSeverity.WARNING);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("symbol", event.getSymbol());
        payload.put("alertKind", event.getAlertKind().name());
        payload.put("label", event.getAlertKind().getLabel());
        payload.put("severity", AlertSeverity.WARNING.name());
        payload.put("lastPrice", result.getSnapshot().getLastPrice());
        payload.put("ratio", result.getRatio());
        payload.put("buyChangePercent", result.getBuyChangePercent());
        payload.put("sellChangePercent", result.getSellChangePercent());
        payload.put("message", text);
        payload.put("timestamp", result.getEvaluatedAt());
        try {
            simpMessagingTemplate.convertAndSend(ALERTS_TOPIC, payload);
        } catch (MessagingException e) {
            log.error("Failed to push alert for {} to {}: {}", event.getSymbol(), ALERTS_TOPIC, e.getMessage());
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onError(MonitoringErrorEvent event) {
        if (event.getScope() != ErrorScope.FATAL) {
            return;
        }
        telegramNotifier.send("⚠️ Monitoring stopped: " + event.getMessage(), AlertSeverity.CRITICAL);
    }
}
