package com.volumemonitor.domain.enums;

/**
 * Kind of order-book imbalance alert. Each side of the book is evaluated
 * independently, so both kinds may fire for the same symbol in one tick.
 */
public enum AlertKind {
    /** Total buy quantity (TBQ) moved past the threshold from its baseline. */
    BUY_SPIKE("TBQ Spike"),

    /** Total sell quantity (TSQ) moved past the threshold from its baseline. */
    SELL_SPIKE("TSQ Spike");

    private final String label;

    AlertKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
