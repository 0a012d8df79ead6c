package com.volumemonitor.core.engine;

import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.enums.ErrorScope;
import com.volumemonitor.domain.enums.MonitoringStatus;
import com.volumemonitor.domain.model.SymbolResult;
import java.util.List;

/**
 * Receives the polling engine's output. All callbacks are invoked on the polling thread;
 * implementations must hand work off rather than block it.
 */
public interface MonitoringListener {

    /** Once per tick with every symbol evaluated successfully during that tick. */
    void onBatchResult(List<SymbolResult> results);

    /** Once per fired alert, after the batch result of the same tick. */
    void onAlert(String symbol, AlertKind alertKind, SymbolResult result);

    void onStatusChanged(MonitoringStatus status);

    /** Non-fatal scopes leave the engine running. FATAL means it has already stopped. */
    void onError(ErrorScope scope, String message);
}
