package com.volumemonitor.core.engine;

import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.model.AlertSettings;
import com.volumemonitor.domain.model.EvaluationResult;
import com.volumemonitor.domain.model.QuoteSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns one quote snapshot plus the symbol's {@link SignalState} into an {@link EvaluationResult}.
 *
 * <p>Per tick:
 * <ol>
 *   <li>First observation of the day seeds the baseline; both changes are 0 and nothing fires.</li>
 *   <li>Change = (current - baseline) / baseline. A zero baseline gives 1.0 for any positive
 *       current quantity, else 0.</li>
 *   <li>Daily extremes are widened with the current quantities.</li>
 *   <li>Each side fires independently when |change| >= its threshold and the cooldown for that
 *       alert kind has elapsed. Firing re-anchors that side's baseline and starts watching for
 *       stability against the current snapshot.</li>
 *   <li>On a tick with no new spike, while stability is being watched, both sides must stay within
 *       the stability threshold of the alert-time snapshot for a contiguous stability duration. The
 *       tick completing that duration becomes the new baseline.</li>
 * </ol>
 *
 * <p>Stateless; the passed SignalState is mutated in place. All thresholds are fractions (0.05 = 5%).
 */
@Component
public class AlertEvaluator {

    public EvaluationResult evaluate(QuoteSnapshot snapshot, SignalState state, AlertSettings settings, Instant now) {
        long buyQty = snapshot.getBuyQuantity();
        long sellQty = snapshot.getSellQuantity();

        state.recordExtremes(buyQty, sellQty);

        if (!state.hasBaseline()) {
            state.setBaselineBuyQty(buyQty);
            state.setBaselineSellQty(sellQty);
            return EvaluationResult.builder()
                    .buyChangePercent(0.0)
                    .sellChangePercent(0.0)
                    .ratio(ratio(buyQty, sellQty))
                    .dailyExtremes(state.extremes())
                    .firedAlertKinds(List.of())
                    .newBaseline(false)
                    .build();
        }

        double buyChange = changeFraction(state.getBaselineBuyQty(), buyQty);
        double sellChange = changeFraction(state.getBaselineSellQty(), sellQty);

        List<AlertKind> fired = new ArrayList<>(2);
        if (breaches(buyChange, settings.getBuyThreshold())
                && cooldownElapsed(state, AlertKind.BUY_SPIKE, settings.getCooldownSeconds(), now)) {
            fired.add(AlertKind.BUY_SPIKE);
            state.recordAlert(AlertKind.BUY_SPIKE, now);
            state.setBaselineBuyQty(buyQty);
        }
        if (breaches(sellChange, settings.getSellThreshold())
                && cooldownElapsed(state, AlertKind.SELL_SPIKE, settings.getCooldownSeconds(), now)) {
            fired.add(AlertKind.SELL_SPIKE);
            state.recordAlert(AlertKind.SELL_SPIKE, now);
            state.setBaselineSellQty(sellQty);
        }

        boolean newBaseline = false;
        if (!fired.isEmpty()) {
            state.setStabilityActive(true);
            state.setStabilityEnteredAt(null);
            state.setLastBaseline(snapshot);
        } else if (state.isStabilityActive()) {
            newBaseline = trackStability(snapshot, state, settings, now);
        }

        return EvaluationResult.builder()
                .buyChangePercent(buyChange)
                .sellChangePercent(sellChange)
                .ratio(ratio(buyQty, sellQty))
                .dailyExtremes(state.extremes())
                .firedAlertKinds(List.copyOf(fired))
                .newBaseline(newBaseline)
                .build();
    }

    /**
     * Relative change of current against baseline. A zero baseline is never divided into:
     * any positive current quantity counts as a 100% move.
     */
    static double changeFraction(long baseline, long current) {
        if (baseline == 0) {
            return current > 0 ? 1.0 : 0.0;
        }
        return (double) (current - baseline) / baseline;
    }

    /** TBQ / TSQ; TBQ itself when TSQ is zero. */
    static double ratio(long buyQty, long sellQty) {
        if (sellQty == 0) {
            return buyQty;
        }
        return (double) buyQty / sellQty;
    }

    private boolean trackStability(QuoteSnapshot snapshot, SignalState state, AlertSettings settings, Instant now) {
        QuoteSnapshot reference = state.getLastBaseline();
        double buyDeviation = Math.abs(changeFraction(reference.getBuyQuantity(), snapshot.getBuyQuantity()));
        double sellDeviation = Math.abs(changeFraction(reference.getSellQuantity(), snapshot.getSellQuantity()));

        if (buyDeviation > settings.getStabilityThreshold() || sellDeviation > settings.getStabilityThreshold()) {
            // streak must be contiguous
            state.setStabilityEnteredAt(null);
            return false;
        }

        if (state.getStabilityEnteredAt() == null) {
            state.setStabilityEnteredAt(now);
        }

        Duration stableFor = Duration.between(state.getStabilityEnteredAt(), now);
        if (stableFor.getSeconds() < settings.getStabilityDurationSeconds()) {
            return false;
        }

        state.setLastBaseline(snapshot);
        state.setBaselineBuyQty(snapshot.getBuyQuantity());
        state.setBaselineSellQty(snapshot.getSellQuantity());
        state.setStabilityActive(false);
        state.setStabilityEnteredAt(null);
        return true;
    }

    private boolean breaches(double change, double threshold) {
        return Math.abs(change) >= threshold;
    }

    private boolean cooldownElapsed(SignalState state, AlertKind kind, long cooldownSeconds, Instant now) {
        return state.lastAlertTime(kind)
                .map(last -> Duration.between(last, now).getSeconds() >= cooldownSeconds)
                .orElse(true);
    }
}
