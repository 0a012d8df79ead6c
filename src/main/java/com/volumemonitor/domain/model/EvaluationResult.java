package com.volumemonitor.domain.model;

import com.volumemonitor.domain.enums.AlertKind;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Output of evaluating one snapshot against a symbol's signal state.
 * Detached from the live state: safe to hand to other threads.
 */
@Value
@Builder
public class EvaluationResult {

    double buyChangePercent;
    double sellChangePercent;

    /** TBQ / TSQ. When TSQ is zero the ratio is TBQ itself (0 when both are zero). */
    double ratio;

    DailyExtremes dailyExtremes;

    /** Alerts fired this tick, at most one entry per kind. */
    List<AlertKind> firedAlertKinds;

    /** True when this observation was promoted to the stability-confirmed baseline. */
    boolean newBaseline;
}
