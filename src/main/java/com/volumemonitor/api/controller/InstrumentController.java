package com.volumemonitor.api.controller;

import com.volumemonitor.api.dto.response.InstrumentResponse;
import com.volumemonitor.domain.enums.InstrumentType;
import com.volumemonitor.mapper.MonitoringDtoMapper;
import com.volumemonitor.service.InstrumentService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/instruments")
public class InstrumentController {

    private static final Logger log = LoggerFactory.getLogger(InstrumentController.class);

    private final InstrumentService instrumentService;
    private final MonitoringDtoMapper monitoringDtoMapper;

    public InstrumentController(InstrumentService instrumentService, MonitoringDtoMapper monitoringDtoMapper) {
        this.instrumentService = instrumentService;
        this.monitoringDtoMapper = monitoringDtoMapper;
    }

    /**
     * Searches today's catalog by symbol prefix or instrument name.
     */
    @GetMapping("/search")
    public ResponseEntity<List<InstrumentResponse>> search(
            @RequestParam("q") String query, @RequestParam(value = "type", required = false) InstrumentType type) {
        return ResponseEntity.ok(monitoringDtoMapper.toInstrumentResponseList(instrumentService.search(query, type)));
    }

    /** Re-downloads today's catalog from Kite. Needs an active broker session. */
    @PostMapping("/refresh")
    public ResponseEntity<Map<String, Object>> refresh() {
        log.info("Instrument refresh requested");
        int count = instrumentService.refreshInstruments();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", count);
        body.put("loadedDate", instrumentService.getLoadedDate().orElse(null));
        return ResponseEntity.ok(body);
    }
}
