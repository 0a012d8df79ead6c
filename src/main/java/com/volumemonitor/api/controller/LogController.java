package com.volumemonitor.api.controller;

import com.volumemonitor.api.dto.response.AlertLogResponse;
import com.volumemonitor.api.dto.response.TradeLogResponse;
import com.volumemonitor.api.dto.response.VolumeLogResponse;
import com.volumemonitor.mapper.MonitoringDtoMapper;
import com.volumemonitor.service.MonitoringLogService;
import com.volumemonitor.trading.AutoTradeService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to the volume, alert and trade logs, newest first.
 */
@RestController
@RequestMapping("/api/logs")
public class LogController {

    private final MonitoringLogService monitoringLogService;
    private final AutoTradeService autoTradeService;
    private final MonitoringDtoMapper monitoringDtoMapper;

    public LogController(
            MonitoringLogService monitoringLogService,
            AutoTradeService autoTradeService,
            MonitoringDtoMapper monitoringDtoMapper) {
        this.monitoringLogService = monitoringLogService;
        this.autoTradeService = autoTradeService;
        this.monitoringDtoMapper = monitoringDtoMapper;
    }

    @GetMapping("/volume")
    public ResponseEntity<List<VolumeLogResponse>> getVolumeLogs(
            @RequestParam(value = "symbol", required = false) String symbol,
            @RequestParam(value = "limit", defaultValue = "100") int limit) {
        return ResponseEntity.ok(
                monitoringDtoMapper.toVolumeLogResponseList(monitoringLogService.getRecentVolumeLogs(symbol, limit)));
    }

    @GetMapping("/alerts/today")
    public ResponseEntity<List<AlertLogResponse>> getTodayAlerts() {
        return ResponseEntity.ok(monitoringDtoMapper.toAlertLogResponseList(monitoringLogService.getTodayAlerts()));
    }

    @GetMapping("/trades")
    public ResponseEntity<List<TradeLogResponse>> getTrades(
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return ResponseEntity.ok(monitoringDtoMapper.toTradeLogResponseList(autoTradeService.getRecentTrades(limit)));
    }
}
