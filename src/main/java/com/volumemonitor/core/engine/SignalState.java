package com.volumemonitor.core.engine;

import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.model.DailyExtremes;
import com.volumemonitor.domain.model.QuoteSnapshot;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rolling per-symbol signal state for one trading day.
 *
 * <p>Owned by the polling loop thread. Mutators are package-private and called only from
 * {@link AlertEvaluator}; everything leaving the engine is copied out of this object first
 * (see {@link #extremes()}).
 *
 * <p>Daily extremes are all null until the first observation, after which max >= min holds
 * for both sides.
 */
public class SignalState {

    private final String symbol;

    private Long baselineBuyQty;
    private Long baselineSellQty;

    private Long dailyMaxBuyQty;
    private Long dailyMinBuyQty;
    private Long dailyMaxSellQty;
    private Long dailyMinSellQty;

    private final Map<AlertKind, Instant> lastAlertTimes = new EnumMap<>(AlertKind.class);

    private boolean stabilityActive;
    private Instant stabilityEnteredAt;
    private QuoteSnapshot lastBaseline;

    public SignalState(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean hasBaseline() {
        return baselineBuyQty != null && baselineSellQty != null;
    }

    public Long getBaselineBuyQty() {
        return baselineBuyQty;
    }

    public Long getBaselineSellQty() {
        return baselineSellQty;
    }

    public Optional<Instant> lastAlertTime(AlertKind kind) {
        return Optional.ofNullable(lastAlertTimes.get(kind));
    }

    public boolean isStabilityActive() {
        return stabilityActive;
    }

    public Instant getStabilityEnteredAt() {
        return stabilityEnteredAt;
    }

    public QuoteSnapshot getLastBaseline() {
        return lastBaseline;
    }

    /** Immutable copy of the current day high/low values. */
    public DailyExtremes extremes() {
        return new DailyExtremes(dailyMaxBuyQty, dailyMinBuyQty, dailyMaxSellQty, dailyMinSellQty);
    }

    // ---- mutated by AlertEvaluator only ----

    void setBaselineBuyQty(long baselineBuyQty) {
        this.baselineBuyQty = baselineBuyQty;
    }

    void setBaselineSellQty(long baselineSellQty) {
        this.baselineSellQty = baselineSellQty;
    }

    void recordExtremes(long buyQty, long sellQty) {
        dailyMaxBuyQty = dailyMaxBuyQty == null ? buyQty : Math.max(dailyMaxBuyQty, buyQty);
        dailyMinBuyQty = dailyMinBuyQty == null ? buyQty : Math.min(dailyMinBuyQty, buyQty);
        dailyMaxSellQty = dailyMaxSellQty == null ? sellQty : Math.max(dailyMaxSellQty, sellQty);
        dailyMinSellQty = dailyMinSellQty == null ? sellQty : Math.min(dailyMinSellQty, sellQty);
    }

    void recordAlert(AlertKind kind, Instant firedAt) {
        lastAlertTimes.put(kind, firedAt);
    }

    void setStabilityActive(boolean stabilityActive) {
        this.stabilityActive = stabilityActive;
    }

    void setStabilityEnteredAt(Instant stabilityEnteredAt) {
        this.stabilityEnteredAt = stabilityEnteredAt;
    }

    void setLastBaseline(QuoteSnapshot lastBaseline) {
        this.lastBaseline = lastBaseline;
    }
}
