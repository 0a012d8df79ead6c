package com.volumemonitor.domain.enums;

/** Outcome of an automated order attempt, as written to the trade log. */
public enum TradeStatus {
    /** Accepted by the broker; an order ID was assigned. */
    PLACED,

    /** Rejected by the broker or failed in transit. */
    REJECTED,

    /** Never sent: the order value exceeded the configured budget cap. */
    BLOCKED
}
