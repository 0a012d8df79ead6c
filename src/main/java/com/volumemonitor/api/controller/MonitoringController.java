package com.volumemonitor.api.controller;

import com.volumemonitor.api.dto.request.StartMonitoringRequest;
import com.volumemonitor.api.dto.response.MonitoringStatusResponse;
import com.volumemonitor.broker.KiteAuthService;
import com.volumemonitor.core.engine.PollingEngine;
import com.volumemonitor.service.MonitoringLogService;
import com.volumemonitor.service.MonitoringService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lifecycle control of the polling engine. Invalid transitions come back as 409, an unusable
 * configuration or watchlist as 400 and a missing broker session as 401.
 */
@RestController
@RequestMapping("/api/monitoring")
public class MonitoringController {

    private static final Logger log = LoggerFactory.getLogger(MonitoringController.class);

    private final MonitoringService monitoringService;
    private final PollingEngine pollingEngine;
    private final MonitoringLogService monitoringLogService;
    private final KiteAuthService kiteAuthService;

    public MonitoringController(
            MonitoringService monitoringService,
            PollingEngine pollingEngine,
            MonitoringLogService monitoringLogService,
            KiteAuthService kiteAuthService) {
        this.monitoringService = monitoringService;
        this.pollingEngine = pollingEngine;
        this.monitoringLogService = monitoringLogService;
        this.kiteAuthService = kiteAuthService;
    }

    /**
     * Starts monitoring the watchlist, or only {@code symbol} when the body names one.
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestBody(required = false) @Valid StartMonitoringRequest request) {
        String symbol = request != null ? request.getSymbol() : null;
        log.info("Start monitoring requested{}", symbol != null ? " for " + symbol : "");
        Set<String> symbols = monitoringService.start(symbol);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", monitoringService.getStatus().name());
        body.put("symbols", symbols);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/pause")
    public ResponseEntity<Map<String, String>> pause() {
        monitoringService.pause();
        return ResponseEntity.ok(Map.of("status", monitoringService.getStatus().name()));
    }

    @PostMapping("/resume")
    public ResponseEntity<Map<String, String>> resume() {
        monitoringService.resume();
        return ResponseEntity.ok(Map.of("status", monitoringService.getStatus().name()));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, String>> stop() {
        monitoringService.stop();
        return ResponseEntity.ok(Map.of("status", monitoringService.getStatus().name()));
    }

    @GetMapping("/status")
    public ResponseEntity<MonitoringStatusResponse> getStatus() {
        MonitoringStatusResponse response = MonitoringStatusResponse.builder()
                .status(pollingEngine.getStatus().name())
                .watchlist(pollingEngine.getWatchlist())
                .trackedSymbolCount(pollingEngine.getTrackedSymbolCount())
                .lastTickAt(pollingEngine.getLastTickAt().orElse(null))
                .alertsToday(monitoringLogService.getTodayAlertCount())
                .brokerAuthenticated(kiteAuthService.isAuthenticated())
                .settings(pollingEngine.getActiveSettings().orElse(null))
                .build();
        return ResponseEntity.ok(response);
    }
}
