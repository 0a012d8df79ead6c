package com.volumemonitor.domain.enums;

/**
 * Order types used by auto-trade. MARKET fills at the best available price; LIMIT is priced
 * off the alert's last traded price.
 */
public enum OrderType {
    MARKET,
    LIMIT
}
