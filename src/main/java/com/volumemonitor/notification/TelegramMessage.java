package com.volumemonitor.notification;

import com.volumemonitor.domain.enums.AlertSeverity;
import lombok.Builder;
import lombok.Data;

/** Message waiting for Telegram delivery; severity orders the backlog queue. */
@Data
@Builder
public class TelegramMessage {

    private String text;
    private AlertSeverity severity;
    private long timestamp;
}
