package com.volumemonitor.domain.model;

import com.volumemonitor.domain.enums.OrderSide;
import com.volumemonitor.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * An order to be placed at the broker in response to an alert.
 */
@Value
@Builder
public class TradeOrder {

    String tradingSymbol;
    String exchange;
    OrderSide side;
    OrderType orderType;
    int quantity;

    /** Limit price. Null for MARKET orders. */
    BigDecimal price;

    /** Kite product code, e.g., "MIS" (intraday) or "NRML". */
    String product;
}
