package com.volumemonitor.trading;

import com.volumemonitor.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for placing an order automatically when an alert fires.
 *
 * <pre>
 * auto-trade.enabled=false
 * auto-trade.quantity=1
 * auto-trade.order-type=LIMIT
 * auto-trade.trade-ltp-percentage=0.0
 * auto-trade.budget-cap=0
 * auto-trade.product=MIS
 * </pre>
 *
 * <p>{@code quantity} is in shares for equities and in lots for futures and options.
 * {@code trade-ltp-percentage} is a percentage (0.25 = 0.25%) added to LTP for buys and
 * subtracted for sells. A {@code budget-cap} of 0 disables the cap.
 */
@Data
@Component
@ConfigurationProperties(prefix = "auto-trade")
public class AutoTradeConfig {

    private boolean enabled = false;
    private int quantity = 1;
    private OrderType orderType = OrderType.LIMIT;
    private double tradeLtpPercentage = 0.0;
    private BigDecimal budgetCap = BigDecimal.ZERO;
    private String product = "MIS";
}
