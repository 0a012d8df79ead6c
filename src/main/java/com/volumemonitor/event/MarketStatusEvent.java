package com.volumemonitor.event;

import com.volumemonitor.domain.enums.MarketPhase;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published by TradingCalendarService when the NSE phase changes (e.g., PRE_OPEN -> NORMAL).
 *
 * <p>Key listeners:
 * <ul>
 *   <li>MonitoringStreamHandler: pushes the phase to the frontend</li>
 *   <li>InstrumentService: refreshes the instrument catalog on transition to PRE_OPEN</li>
 * </ul>
 */
public class MarketStatusEvent extends ApplicationEvent {

    private final MarketPhase previousPhase;
    private final MarketPhase currentPhase;
    private final LocalDateTime transitionTime;

    public MarketStatusEvent(
            Object source, MarketPhase previousPhase, MarketPhase currentPhase, LocalDateTime transitionTime) {
        super(source);
        this.previousPhase = previousPhase;
        this.currentPhase = currentPhase;
        this.transitionTime = transitionTime;
    }

    public MarketPhase getPreviousPhase() {
        return previousPhase;
    }

    public MarketPhase getCurrentPhase() {
        return currentPhase;
    }

    public LocalDateTime getTransitionTime() {
        return transitionTime;
    }
}
