package com.volumemonitor.unit.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.volumemonitor.api.websocket.MonitoringStreamHandler;
import com.volumemonitor.api.websocket.WebSocketMessage;
import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.enums.ErrorScope;
import com.volumemonitor.domain.enums.MarketPhase;
import com.volumemonitor.domain.enums.MonitoringStatus;
import com.volumemonitor.event.MarketStatusEvent;
import com.volumemonitor.event.MonitoringBatchEvent;
import com.volumemonitor.event.MonitoringErrorEvent;
import com.volumemonitor.event.MonitoringStatusEvent;
import com.volumemonitor.support.SymbolResults;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Unit tests for {@link MonitoringStreamHandler}.
 */
@ExtendWith(MockitoExtension.class)
class MonitoringStreamHandlerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 10, 15);

    @Mock
    private SimpMessagingTemplate simpMessagingTemplate;

    private MonitoringStreamHandler monitoringStreamHandler;

    @BeforeEach
    void setUp() {
        monitoringStreamHandler = new MonitoringStreamHandler(simpMessagingTemplate);
    }

    private WebSocketMessage sentTo(String destination) {
        ArgumentCaptor<WebSocketMessage> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(simpMessagingTemplate).convertAndSend(eq(destination), captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Batch results are flattened to one row per symbol")
    @SuppressWarnings("unchecked")
    void batchResults() {
        monitoringStreamHandler.onBatch(new MonitoringBatchEvent(this, List.of(SymbolResults.reliance(AlertKind.BUY_SPIKE))));

        WebSocketMessage message = sentTo("/topic/monitoring/results");
        assertThat(message.getType()).isEqualTo("RESULTS");
        List<Map<String, Object>> rows = (List<Map<String, Object>>) message.getData();
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0))
                .containsEntry("symbol", "RELIANCE")
                .containsEntry("instrumentType", "EQ")
                .containsEntry("totalBuyQty", 125_000L)
                .containsEntry("dayHighBuyQty", 130_000L)
                .containsEntry("alerts", List.of("BUY_SPIKE"))
                .containsEntry("newBaseline", false);
    }

    @Test
    @DisplayName("Status changes go to the status topic")
    @SuppressWarnings("unchecked")
    void statusChange() {
        monitoringStreamHandler.onStatus(new MonitoringStatusEvent(this, MonitoringStatus.MARKET_CLOSED, NOW));

        WebSocketMessage message = sentTo("/topic/monitoring/status");
        assertThat(message.getType()).isEqualTo("STATUS");
        assertThat((Map<String, Object>) message.getData()).containsEntry("status", "MARKET_CLOSED");
    }

    @Test
    @DisplayName("Market phase changes share the status topic with their own type")
    @SuppressWarnings("unchecked")
    void marketPhase() {
        monitoringStreamHandler.onMarketStatus(
                new MarketStatusEvent(this, MarketPhase.PRE_OPEN_ORDER_MATCHING, MarketPhase.NORMAL, NOW));

        WebSocketMessage message = sentTo("/topic/monitoring/status");
        assertThat(message.getType()).isEqualTo("MARKET");
        assertThat((Map<String, Object>) message.getData())
                .containsEntry("previousPhase", "PRE_OPEN_ORDER_MATCHING")
                .containsEntry("currentPhase", "NORMAL");
    }

    @Test
    @DisplayName("Errors carry the lower-case scope")
    @SuppressWarnings("unchecked")
    void errors() {
        monitoringStreamHandler.onError(new MonitoringErrorEvent(this, ErrorScope.BATCH, "Quote batch of 200 failed", NOW));

        WebSocketMessage message = sentTo("/topic/monitoring/errors");
        assertThat(message.getType()).isEqualTo("ERROR");
        assertThat((Map<String, Object>) message.getData())
                .containsEntry("scope", "batch")
                .containsEntry("message", "Quote batch of 200 failed");
    }

    @Test
    @DisplayName("A broker delivery failure is logged, not thrown")
    void deliveryFailureContained() {
        doThrow(new MessageDeliveryException("no subscribers"))
                .when(simpMessagingTemplate)
                .convertAndSend(any(String.class), any(WebSocketMessage.class));

        monitoringStreamHandler.onStatus(new MonitoringStatusEvent(this, MonitoringStatus.RUNNING, NOW));
    }
}
