package com.volumemonitor.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One quote for one instrument at one point in time, as returned by the quote endpoint.
 *
 * <p>Ephemeral: produced by a QuoteSource and consumed once per tick. The buy/sell
 * quantities are the aggregate resting sizes across the whole order book (TBQ/TSQ),
 * not just the top five depth levels.
 */
@Value
@Builder
public class QuoteSnapshot {

    long token;
    BigDecimal lastPrice;

    /** Total buy quantity (TBQ). */
    long buyQuantity;

    /** Total sell quantity (TSQ). */
    long sellQuantity;

    BigDecimal open;
    BigDecimal high;
    BigDecimal low;

    /** Previous day's closing price. */
    BigDecimal close;

    LocalDateTime timestamp;
}
