package com.volumemonitor.api.websocket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for every STOMP message pushed to clients: {@code { type, data }}.
 * The type ("RESULTS", "STATUS", "ERROR", "MARKET") tells the client how to read data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebSocketMessage {

    private String type;

    private Object data;

    public static WebSocketMessage of(String type, Object data) {
        return new WebSocketMessage(type, data);
    }
}
