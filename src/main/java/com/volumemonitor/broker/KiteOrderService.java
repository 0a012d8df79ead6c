package com.volumemonitor.broker;

import com.volumemonitor.broker.mapper.KiteOrderMapper;
import com.volumemonitor.domain.model.TradeOrder;
import com.volumemonitor.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import java.io.IOException;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Places auto-trade orders against the Kite Connect API.
 *
 * <p>Rate limited by the {@code kiteOrders} Resilience4j limiter (8 req/sec, below Kite's
 * 10/sec order limit). Orders are not retried: a duplicate order is worse than a missed one.
 *
 * <p>Kite's checked exceptions (KiteException, JSONException, IOException) are wrapped
 * into the unchecked {@link BrokerException}.
 */
@Service
public class KiteOrderService {

    private static final Logger log = LoggerFactory.getLogger(KiteOrderService.class);

    private final KiteConnect kiteConnect;
    private final KiteOrderMapper kiteOrderMapper;

    public KiteOrderService(KiteConnect kiteConnect, KiteOrderMapper kiteOrderMapper) {
        this.kiteConnect = kiteConnect;
        this.kiteOrderMapper = kiteOrderMapper;
    }

    /**
     * Places an order via Kite API using regular variety.
     *
     * @param order the order to place
     * @return the Kite-assigned order ID
     * @throws BrokerException if the order is rejected or API call fails
     */
    @RateLimiter(name = "kiteOrders")
    public String placeOrder(TradeOrder order) {
        OrderParams params = kiteOrderMapper.toOrderParams(order);
        try {
            Order kiteOrder = kiteConnect.placeOrder(params, Constants.VARIETY_REGULAR);
            log.info(
                    "Order placed: orderId={} symbol={} side={} qty={}",
                    kiteOrder.orderId,
                    order.getTradingSymbol(),
                    order.getSide(),
                    order.getQuantity());
            return kiteOrder.orderId;
        } catch (KiteException e) {
            log.error("Kite order placement failed for {}: {}", order.getTradingSymbol(), e.message);
            throw new BrokerException("Order placement failed: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Order placement error for {}", order.getTradingSymbol(), e);
            throw new BrokerException("Order placement error: " + e.getMessage(), e);
        }
    }
}
