package com.volumemonitor.api.websocket;

import com.volumemonitor.domain.model.DailyExtremes;
import com.volumemonitor.domain.model.QuoteSnapshot;
import com.volumemonitor.domain.model.SymbolResult;
import com.volumemonitor.event.MarketStatusEvent;
import com.volumemonitor.event.MonitoringBatchEvent;
import com.volumemonitor.event.MonitoringErrorEvent;
import com.volumemonitor.event.MonitoringStatusEvent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Streams the monitoring engine's output to STOMP clients:
 * <ul>
 *   <li>{@code /topic/monitoring/results} -- every evaluated tick, one row per symbol</li>
 *   <li>{@code /topic/monitoring/status} -- engine status changes and market phase changes</li>
 *   <li>{@code /topic/monitoring/errors} -- batch, resolve and fatal errors</li>
 * </ul>
 *
 * <p>Results are flattened to maps so the client never sees the domain model.
 */
@Component
public class MonitoringStreamHandler {

    private static final Logger log = LoggerFactory.getLogger(MonitoringStreamHandler.class);

    static final String RESULTS_TOPIC = "/topic/monitoring/results";
    static final String STATUS_TOPIC = "/topic/monitoring/status";
    static final String ERRORS_TOPIC = "/topic/monitoring/errors";

    private final SimpMessagingTemplate simpMessagingTemplate;

    public MonitoringStreamHandler(SimpMessagingTemplate simpMessagingTemplate) {
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    @Async("eventExecutor")
    @EventListener
    public void onBatch(MonitoringBatchEvent event) {
        List<Map<String, Object>> rows =
                event.getResults().stream().map(MonitoringStreamHandler::toPayload).toList();
        send(RESULTS_TOPIC, WebSocketMessage.of("RESULTS", rows));
    }

    @Async("eventExecutor")
    @EventListener
    public void onStatus(MonitoringStatusEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", event.getStatus().name());
        payload.put("changedAt", event.getChangedAt());
        send(STATUS_TOPIC, WebSocketMessage.of("STATUS", payload));
    }

    @Async("eventExecutor")
    @EventListener
    public void onMarketStatus(MarketStatusEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("previousPhase", event.getPreviousPhase() != null ? event.getPreviousPhase().name() : null);
        payload.put("currentPhase", event.getCurrentPhase().name());
        payload.put("transitionTime", event.getTransitionTime());
        send(STATUS_TOPIC, WebSocketMessage.of("MARKET", payload));
    }

    @Async("eventExecutor")
    @EventListener
    public void onError(MonitoringErrorEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("scope", event.getScope().getWireName());
        payload.put("message", event.getMessage());
        payload.put("occurredAt", event.getOccurredAt());
        send(ERRORS_TOPIC, WebSocketMessage.of("ERROR", payload));
    }

    static Map<String, Object> toPayload(SymbolResult result) {
        QuoteSnapshot snapshot = result.getSnapshot();
        DailyExtremes extremes = result.getDailyExtremes() != null ? result.getDailyExtremes() : DailyExtremes.EMPTY;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("symbol", result.getSymbol());
        payload.put(
                "instrumentType",
                result.getInstrument() != null && result.getInstrument().getInstrumentType() != null
                        ? result.getInstrument().getInstrumentType().name()
                        : null);
        payload.put("lastPrice", snapshot.getLastPrice());
        payload.put("open", snapshot.getOpen());
        payload.put("high", snapshot.getHigh());
        payload.put("low", snapshot.getLow());
        payload.put("close", snapshot.getClose());
        payload.put("totalBuyQty", snapshot.getBuyQuantity());
        payload.put("totalSellQty", snapshot.getSellQuantity());
        payload.put("buyChangePercent", result.getBuyChangePercent());
        payload.put("sellChangePercent", result.getSellChangePercent());
        payload.put("ratio", result.getRatio());
        payload.put("dayHighBuyQty", extremes.getMaxBuyQty());
        payload.put("dayLowBuyQty", extremes.getMinBuyQty());
        payload.put("dayHighSellQty", extremes.getMaxSellQty());
        payload.put("dayLowSellQty", extremes.getMinSellQty());
        payload.put(
                "alerts", result.getFiredAlertKinds().stream().map(Enum::name).toList());
        payload.put("newBaseline", result.isNewBaseline());
        payload.put("evaluatedAt", result.getEvaluatedAt());
        return payload;
    }

    private void send(String destination, WebSocketMessage message) {
        try {
            simpMessagingTemplate.convertAndSend(destination, message);
        } catch (MessagingException e) {
            log.error("Failed to push {} to {}: {}", message.getType(), destination, e.getMessage());
        }
    }
}
