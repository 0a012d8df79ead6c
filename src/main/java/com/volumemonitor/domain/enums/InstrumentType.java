package com.volumemonitor.domain.enums;

/**
 * Type of tradeable instrument on NSE/NFO exchanges.
 * Maps to Kite API's instrument_type field in the instruments dump.
 */
public enum InstrumentType {
    EQ,
    FUT,
    CE,
    PE;

    /** Equities trade on NSE; futures and options on NFO. */
    public String defaultExchange() {
        return this == EQ ? "NSE" : "NFO";
    }

    public boolean isOption() {
        return this == CE || this == PE;
    }
}
