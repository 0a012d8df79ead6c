package com.volumemonitor.calendar;

import java.time.Instant;

/**
 * Market-hours gate consulted by the polling loop on every tick.
 */
public interface MarketCalendar {

    /** True while the configured monitoring session is open on a trading day. */
    boolean isOpen(Instant now);

    /** True once today's session has ended. The engine stops itself when this turns true. */
    boolean isSessionOver(Instant now);

    /**
     * Checks the configured session window.
     *
     * @throws com.volumemonitor.exception.ConfigurationException when it is missing or inverted
     */
    void validateSessionWindow();
}
