package com.volumemonitor.api.dto.response;

import com.volumemonitor.domain.model.AlertSettings;
import java.time.Instant;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Snapshot of the engine for GET /api/monitoring/status. {@code settings} is only present
 * while a monitoring session is active.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonitoringStatusResponse {

    private String status;
    private Set<String> watchlist;
    private int trackedSymbolCount;
    private Instant lastTickAt;
    private long alertsToday;
    private boolean brokerAuthenticated;
    private AlertSettings settings;
}
