package com.volumemonitor.domain.model;

import com.volumemonitor.domain.enums.AlertKind;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Per-symbol outcome of one tick, emitted to consumers in the batch result.
 *
 * <p>Consumers must key updates by {@link #getSymbol()}; the order of results within
 * a batch carries no meaning.
 */
@Value
@Builder
public class SymbolResult {

    String symbol;
    InstrumentRef instrument;
    QuoteSnapshot snapshot;
    double buyChangePercent;
    double sellChangePercent;
    double ratio;
    DailyExtremes dailyExtremes;
    List<AlertKind> firedAlertKinds;
    boolean newBaseline;
    LocalDateTime evaluatedAt;

    public boolean isAlertTriggered() {
        return !firedAlertKinds.isEmpty();
    }

    public static SymbolResult of(
            InstrumentRef instrument, QuoteSnapshot snapshot, EvaluationResult evaluation, LocalDateTime evaluatedAt) {
        return SymbolResult.builder()
                .symbol(instrument.getSymbol())
                .instrument(instrument)
                .snapshot(snapshot)
                .buyChangePercent(evaluation.getBuyChangePercent())
                .sellChangePercent(evaluation.getSellChangePercent())
                .ratio(evaluation.getRatio())
                .dailyExtremes(evaluation.getDailyExtremes())
                .firedAlertKinds(List.copyOf(evaluation.getFiredAlertKinds()))
                .newBaseline(evaluation.isNewBaseline())
                .evaluatedAt(evaluatedAt)
                .build();
    }
}
