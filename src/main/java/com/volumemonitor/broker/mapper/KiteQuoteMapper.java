package com.volumemonitor.broker.mapper;

import com.volumemonitor.domain.model.QuoteSnapshot;
import com.zerodhatech.models.Quote;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import org.springframework.stereotype.Component;

/**
 * Maps Kite SDK {@link Quote} objects to {@link QuoteSnapshot}.
 *
 * <p>Kite SDK uses public fields and doubles throughout, so the mapping is manual:
 * prices become BigDecimal, the aggregate buy/sell quantities become longs, and the
 * OHLC nested object is flattened.
 */
@Component
public class KiteQuoteMapper {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    public QuoteSnapshot toSnapshot(Quote quote, long token) {
        return QuoteSnapshot.builder()
                .token(token)
                .lastPrice(BigDecimal.valueOf(quote.lastPrice))
                .buyQuantity((long) quote.buyQuantity)
                .sellQuantity((long) quote.sellQuantity)
                .open(quote.ohlc != null ? BigDecimal.valueOf(quote.ohlc.open) : BigDecimal.ZERO)
                .high(quote.ohlc != null ? BigDecimal.valueOf(quote.ohlc.high) : BigDecimal.ZERO)
                .low(quote.ohlc != null ? BigDecimal.valueOf(quote.ohlc.low) : BigDecimal.ZERO)
                .close(quote.ohlc != null ? BigDecimal.valueOf(quote.ohlc.close) : BigDecimal.ZERO)
                .timestamp(toLocalDateTime(quote.timestamp))
                .build();
    }

    /** Converts Kite's java.util.Date to LocalDateTime in IST. Null stays null. */
    private LocalDateTime toLocalDateTime(Date date) {
        if (date == null) {
            return null;
        }
        return date.toInstant().atZone(IST).toLocalDateTime();
    }
}
