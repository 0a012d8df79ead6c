package com.volumemonitor.domain.enums;

/**
 * Externally visible state of the polling engine.
 *
 * <p>RUNNING, PAUSED and STOPPED are the run-control states. MARKET_CLOSED is reported
 * while the engine is running but the market-hours gate is shut, so ticks skip fetching.
 */
public enum MonitoringStatus {
    RUNNING,
    PAUSED,
    STOPPED,
    MARKET_CLOSED
}
