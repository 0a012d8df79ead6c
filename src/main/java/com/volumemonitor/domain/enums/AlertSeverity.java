package com.volumemonitor.domain.enums;

/**
 * Severity of an outbound notification.
 *
 * <p>Ordinal ordering is used by TelegramNotifier's priority queue
 * so that CRITICAL messages are sent first when rate-limited.
 */
public enum AlertSeverity {

    /** Engine stopped on its own (auth failure, fatal fault). Sent immediately. */
    CRITICAL,

    /** Order-book spike alerts and auto-trade outcomes. */
    WARNING,

    /** Informational, no action required. */
    INFO
}
