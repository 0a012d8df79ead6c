package com.volumemonitor.event;

import com.volumemonitor.domain.enums.MonitoringStatus;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

public class MonitoringStatusEvent extends ApplicationEvent {

    private final MonitoringStatus status;
    private final LocalDateTime changedAt;

    public MonitoringStatusEvent(Object source, MonitoringStatus status, LocalDateTime changedAt) {
        super(source);
        this.status = status;
        this.changedAt = changedAt;
    }

    public MonitoringStatus getStatus() {
        return status;
    }

    public LocalDateTime getChangedAt() {
        return changedAt;
    }
}
