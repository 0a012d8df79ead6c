package com.volumemonitor.api.controller;

import com.volumemonitor.api.dto.request.SymbolRequest;
import com.volumemonitor.api.dto.response.WatchlistEntryResponse;
import com.volumemonitor.entity.WatchlistEntryEntity;
import com.volumemonitor.mapper.MonitoringDtoMapper;
import com.volumemonitor.service.WatchlistService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/watchlist")
public class WatchlistController {

    private final WatchlistService watchlistService;
    private final MonitoringDtoMapper monitoringDtoMapper;

    public WatchlistController(WatchlistService watchlistService, MonitoringDtoMapper monitoringDtoMapper) {
        this.watchlistService = watchlistService;
        this.monitoringDtoMapper = monitoringDtoMapper;
    }

    @GetMapping
    public ResponseEntity<List<WatchlistEntryResponse>> getAll() {
        return ResponseEntity.ok(monitoringDtoMapper.toWatchlistResponseList(watchlistService.getEntries()));
    }

    /**
     * Adds a symbol after checking it against today's instrument catalog. 404 if unknown.
     */
    @PostMapping
    public ResponseEntity<WatchlistEntryResponse> add(@RequestBody @Valid SymbolRequest request) {
        WatchlistEntryEntity entry = watchlistService.add(request.getSymbol());
        return ResponseEntity.status(HttpStatus.CREATED).body(monitoringDtoMapper.toResponse(entry));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, String>> remove(@RequestBody @Valid SymbolRequest request) {
        watchlistService.remove(request.getSymbol());
        return ResponseEntity.ok(Map.of("message", "Removed " + request.getSymbol().trim() + " from watchlist"));
    }
}
