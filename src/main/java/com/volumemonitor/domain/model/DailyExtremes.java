package com.volumemonitor.domain.model;

import lombok.Value;

/**
 * Running day high/low of TBQ and TSQ for one symbol. All four values are null
 * until the symbol's first observation of the day.
 */
@Value
public class DailyExtremes {

    public static final DailyExtremes EMPTY = new DailyExtremes(null, null, null, null);

    Long maxBuyQty;
    Long minBuyQty;
    Long maxSellQty;
    Long minSellQty;
}
