package com.volumemonitor.event;

import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.model.SymbolResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per fired alert, after the {@link MonitoringBatchEvent} of the same tick.
 * Consumed by notification and auto-trade.
 */
public class AlertTriggeredEvent extends ApplicationEvent {

    private final String symbol;
    private final AlertKind alertKind;
    private final SymbolResult result;

    public AlertTriggeredEvent(Object source, String symbol, AlertKind alertKind, SymbolResult result) {
        super(source);
        this.symbol = symbol;
        this.alertKind = alertKind;
        this.result = result;
    }

    public String getSymbol() {
        return symbol;
    }

    public AlertKind getAlertKind() {
        return alertKind;
    }

    public SymbolResult getResult() {
        return result;
    }
}
