package com.volumemonitor.domain.enums;

/** Buy or sell side of an order. Maps to Kite API's transaction_type field. */
public enum OrderSide {
    BUY,
    SELL;

    /** Buy-side pressure (TBQ spike) maps to BUY, sell-side pressure to SELL. */
    public static OrderSide forAlert(AlertKind alertKind) {
        return alertKind == AlertKind.BUY_SPIKE ? BUY : SELL;
    }
}
