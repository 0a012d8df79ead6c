package com.volumemonitor.domain.model;

import com.volumemonitor.domain.enums.InstrumentType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A resolved, tradeable contract (equity, future, or option) from the instrument catalog.
 *
 * <p>Immutable once resolved. The token is Kite's unique numeric identifier and is the key
 * the quote endpoint's responses are matched on; the symbol is what the watchlist holds.
 */
@Value
@Builder
public class InstrumentRef {

    /** Exchange trading symbol, e.g., "RELIANCE" or "NIFTY24FEB22000CE". */
    String symbol;

    /** Display name from the instrument dump: company name for equities, underlying for F&O. */
    String name;

    InstrumentType instrumentType;

    /** Exchange code: "NSE" or "NFO". */
    String exchange;

    /** Kite's unique numeric instrument identifier. */
    long token;

    /** Expiry date for F&O instruments. Null for equities. */
    LocalDate expiry;

    /** Strike price for options. Null for equities and futures. */
    BigDecimal strike;

    /** Contract lot size. 1 for equities. */
    int lotSize;

    /** Instrument key in the form the Kite quote API expects, e.g., "NSE:RELIANCE". */
    public String quoteKey() {
        return exchange + ":" + symbol;
    }
}
