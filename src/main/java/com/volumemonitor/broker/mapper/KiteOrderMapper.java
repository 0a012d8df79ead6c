package com.volumemonitor.broker.mapper;

import com.volumemonitor.domain.enums.OrderSide;
import com.volumemonitor.domain.enums.OrderType;
import com.volumemonitor.domain.model.TradeOrder;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.OrderParams;
import org.springframework.stereotype.Component;

/**
 * Builds Kite {@link OrderParams} from a {@link TradeOrder}.
 *
 * <p>Kite SDK uses public fields rather than setters, so MapStruct cannot generate this mapping.
 */
@Component
public class KiteOrderMapper {

    /**
     * Exchange defaults to NSE when the order has none; product defaults to MIS (intraday).
     * Price is only sent for LIMIT orders.
     */
    public OrderParams toOrderParams(TradeOrder order) {
        OrderParams params = new OrderParams();
        params.tradingsymbol = order.getTradingSymbol();
        params.exchange = order.getExchange() != null ? order.getExchange() : Constants.EXCHANGE_NSE;
        params.transactionType =
                order.getSide() == OrderSide.BUY ? Constants.TRANSACTION_TYPE_BUY : Constants.TRANSACTION_TYPE_SELL;
        params.orderType = mapToKiteOrderType(order.getOrderType());
        params.quantity = order.getQuantity();
        params.product = order.getProduct() != null ? order.getProduct() : Constants.PRODUCT_MIS;
        params.validity = Constants.VALIDITY_DAY;

        if (order.getOrderType() == OrderType.LIMIT && order.getPrice() != null) {
            params.price = order.getPrice().doubleValue();
        }
        return params;
    }

    String mapToKiteOrderType(OrderType type) {
        if (type == null) {
            return Constants.ORDER_TYPE_MARKET;
        }
        return switch (type) {
            case MARKET -> Constants.ORDER_TYPE_MARKET;
            case LIMIT -> Constants.ORDER_TYPE_LIMIT;
        };
    }
}
