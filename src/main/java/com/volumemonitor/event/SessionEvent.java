package com.volumemonitor.event;

import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the Kite session starts or ends.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>InstrumentService: loads today's catalog once a session is available</li>
 *   <li>MonitoringService: stops monitoring on logout</li>
 * </ul>
 */
public class SessionEvent extends ApplicationEvent {

    private final SessionEventType eventType;
    private final String userId;
    private final LocalDateTime occurredAt;

    public SessionEvent(Object source, SessionEventType eventType, String userId, LocalDateTime occurredAt) {
        super(source);
        this.eventType = eventType;
        this.userId = userId;
        this.occurredAt = occurredAt;
    }

    public SessionEventType getEventType() {
        return eventType;
    }

    public String getUserId() {
        return userId;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }

    public boolean isAuthenticated() {
        return eventType != SessionEventType.LOGGED_OUT;
    }
}
