package com.volumemonitor.event;

import com.volumemonitor.domain.enums.ErrorScope;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * A degraded or failed tick. Only {@link ErrorScope#FATAL} means monitoring has stopped;
 * the other scopes describe symbols missing from an otherwise healthy tick.
 */
public class MonitoringErrorEvent extends ApplicationEvent {

    private final ErrorScope scope;
    private final String message;
    private final LocalDateTime occurredAt;

    public MonitoringErrorEvent(Object source, ErrorScope scope, String message, LocalDateTime occurredAt) {
        super(source);
        this.scope = scope;
        this.message = message;
        this.occurredAt = occurredAt;
    }

    public ErrorScope getScope() {
        return scope;
    }

    public String getMessage() {
        return message;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
