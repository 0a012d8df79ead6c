package com.volumemonitor.event;

import com.volumemonitor.domain.model.SymbolResult;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per tick with every symbol evaluated in that tick.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>MonitoringLogService: writes one volume log row per result and one alert row per fired alert</li>
 *   <li>MonitoringStreamHandler: pushes the results to the frontend</li>
 *   <li>MonitoringMetrics: counts ticks</li>
 * </ul>
 */
public class MonitoringBatchEvent extends ApplicationEvent {

    private final List<SymbolResult> results;

    public MonitoringBatchEvent(Object source, List<SymbolResult> results) {
        super(source);
        this.results = List.copyOf(results);
    }

    public List<SymbolResult> getResults() {
        return results;
    }
}
