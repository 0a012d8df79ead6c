package com.volumemonitor.trading;

import com.volumemonitor.broker.KiteOrderService;
import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.enums.AlertSeverity;
import com.volumemonitor.domain.enums.InstrumentType;
import com.volumemonitor.domain.enums.OrderSide;
import com.volumemonitor.domain.enums.OrderType;
import com.volumemonitor.domain.enums.TradeStatus;
import com.volumemonitor.domain.model.InstrumentRef;
import com.volumemonitor.domain.model.SymbolResult;
import com.volumemonitor.domain.model.TradeOrder;
import com.volumemonitor.entity.TradeLogEntity;
import com.volumemonitor.event.AlertTriggeredEvent;
import com.volumemonitor.exception.BaseException;
import com.volumemonitor.notification.TelegramNotifier;
import com.volumemonitor.repository.jpa.TradeLogJpaRepository;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Places an order for every fired alert when auto-trade is enabled.
 *
 * <p>A TBQ spike buys and a TSQ spike sells. LIMIT orders are priced off the alert tick's LTP,
 * moved by {@code trade-ltp-percentage} in the direction of the trade and rounded to the
 * exchange tick size. Orders whose value exceeds the budget cap are never sent.
 *
 * <p>Every attempt lands in trade_logs as PLACED, REJECTED or BLOCKED, along with the
 * symbol, alert kind and tick time of the alert that caused it.
 */
@Service
public class AutoTradeService {

    private static final Logger log = LoggerFactory.getLogger(AutoTradeService.class);

    static final BigDecimal TICK_SIZE = new BigDecimal("0.05");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AutoTradeConfig autoTradeConfig;
    private final KiteOrderService kiteOrderService;
    private final TradeLogJpaRepository tradeLogJpaRepository;
    private final TelegramNotifier telegramNotifier;
    private final Clock clock;

    public AutoTradeService(
            AutoTradeConfig autoTradeConfig,
            KiteOrderService kiteOrderService,
            TradeLogJpaRepository tradeLogJpaRepository,
            TelegramNotifier telegramNotifier,
            Clock clock) {
        this.autoTradeConfig = autoTradeConfig;
        this.kiteOrderService = kiteOrderService;
        this.tradeLogJpaRepository = tradeLogJpaRepository;
        this.telegramNotifier = telegramNotifier;
        this.clock = clock;
    }

    @Async("eventExecutor")
    @EventListener
    public void onAlert(AlertTriggeredEvent event) {
        if (!autoTradeConfig.isEnabled()) {
            return;
        }
        execute(event.getAlertKind(), event.getResult());
    }

    /**
     * Builds, checks and places the order for one alert and records the outcome.
     *
     * @return the trade log row written for this attempt
     */
    public TradeLogEntity execute(AlertKind alertKind, SymbolResult result) {
        TradeOrder order = buildOrder(alertKind, result);
        BigDecimal referencePrice = order.getPrice() != null ? order.getPrice() : result.getSnapshot().getLastPrice();

        TradeLogEntity tradeLog = TradeLogEntity.builder()
                .timestamp(LocalDateTime.now(clock))
                .symbol(order.getTradingSymbol())
                .exchange(order.getExchange())
                .side(order.getSide())
                .orderType(order.getOrderType())
                .quantity(order.getQuantity())
                .price(referencePrice)
                .alertKind(alertKind)
                .alertTime(result.getEvaluatedAt())
                .build();

        BigDecimal orderValue = referencePrice != null
                ? referencePrice.multiply(BigDecimal.valueOf(order.getQuantity()))
                : BigDecimal.ZERO;
        if (exceedsBudget(orderValue)) {
            tradeLog.setStatus(TradeStatus.BLOCKED);
            tradeLog.setStatusMessage("Order value " + orderValue.setScale(2, RoundingMode.HALF_UP)
                    + " exceeds budget cap " + autoTradeConfig.getBudgetCap());
            log.warn("Auto-trade blocked for {}: {}", order.getTradingSymbol(), tradeLog.getStatusMessage());
            return tradeLogJpaRepository.save(tradeLog);
        }

        try {
            String orderId = kiteOrderService.placeOrder(order);
            tradeLog.setStatus(TradeStatus.PLACED);
            tradeLog.setBrokerOrderId(orderId);
            log.info(
                    "Auto-trade {} {} x{} placed on {} (orderId={})",
                    order.getSide(),
                    order.getTradingSymbol(),
                    order.getQuantity(),
                    alertKind.getLabel(),
                    orderId);
        } catch (BaseException | RequestNotPermitted e) {
            log.error("Auto-trade {} {} rejected: {}", order.getSide(), order.getTradingSymbol(), e.getMessage());
            reject(tradeLog, order, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Auto-trade {} {} failed unexpectedly", order.getSide(), order.getTradingSymbol(), e);
            reject(tradeLog, order, "Unexpected error: " + e.getMessage());
        }

        TradeLogEntity saved = tradeLogJpaRepository.save(tradeLog);
        if (saved.getStatus() == TradeStatus.PLACED) {
            telegramNotifier.send(
                    "Auto-trade " + order.getSide() + " " + order.getTradingSymbol() + " x" + order.getQuantity()
                            + " placed (order " + saved.getBrokerOrderId() + ")",
                    AlertSeverity.WARNING);
        }
        return saved;
    }

    private void reject(TradeLogEntity tradeLog, TradeOrder order, String reason) {
        tradeLog.setStatus(TradeStatus.REJECTED);
        tradeLog.setStatusMessage(reason);
        telegramNotifier.send(
                "Auto-trade " + order.getSide() + " " + order.getTradingSymbol() + " failed: " + reason,
                AlertSeverity.WARNING);
    }

    public List<TradeLogEntity> getRecentTrades(int limit) {
        return tradeLogJpaRepository.findAllByOrderByTimestampDesc(PageRequest.of(0, Math.max(1, Math.min(limit, 500))));
    }

    TradeOrder buildOrder(AlertKind alertKind, SymbolResult result) {
        InstrumentRef instrument = result.getInstrument();
        OrderSide side = OrderSide.forAlert(alertKind);
        OrderType orderType = autoTradeConfig.getOrderType() != null ? autoTradeConfig.getOrderType() : OrderType.MARKET;

        int quantity = autoTradeConfig.getQuantity();
        if (instrument.getInstrumentType() != null
                && instrument.getInstrumentType() != InstrumentType.EQ) {
            quantity *= Math.max(1, instrument.getLotSize());
        }

        BigDecimal price = orderType == OrderType.LIMIT
                ? limitPrice(result.getSnapshot().getLastPrice(), side, autoTradeConfig.getTradeLtpPercentage())
                : null;

        return TradeOrder.builder()
                .tradingSymbol(instrument.getSymbol())
                .exchange(instrument.getExchange())
                .side(side)
                .orderType(orderType)
                .quantity(quantity)
                .price(price)
                .product(autoTradeConfig.getProduct())
                .build();
    }

    /** LTP moved by {@code percentage}% toward the trade side, rounded to the nearest tick. */
    static BigDecimal limitPrice(BigDecimal lastPrice, OrderSide side, double percentage) {
        if (lastPrice == null) {
            return null;
        }
        BigDecimal offset = BigDecimal.valueOf(percentage).divide(HUNDRED);
        BigDecimal factor = side == OrderSide.BUY ? BigDecimal.ONE.add(offset) : BigDecimal.ONE.subtract(offset);
        BigDecimal raw = lastPrice.multiply(factor);
        return raw.divide(TICK_SIZE, 0, RoundingMode.HALF_UP).multiply(TICK_SIZE).setScale(2, RoundingMode.UNNECESSARY);
    }

    private boolean exceedsBudget(BigDecimal orderValue) {
        BigDecimal cap = autoTradeConfig.getBudgetCap();
        return cap != null && cap.signum() > 0 && orderValue.compareTo(cap) > 0;
    }
}
