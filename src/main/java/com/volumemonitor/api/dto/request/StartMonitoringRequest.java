package com.volumemonitor.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Optional body of POST /api/monitoring/start. Without a symbol the whole watchlist is monitored.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StartMonitoringRequest {

    @Size(max = 50)
    private String symbol;
}
