package com.volumemonitor.unit.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.volumemonitor.api.controller.LogController;
import com.volumemonitor.api.dto.response.AlertLogResponse;
import com.volumemonitor.api.dto.response.TradeLogResponse;
import com.volumemonitor.api.dto.response.VolumeLogResponse;
import com.volumemonitor.config.ApiResponseAdvice;
import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.entity.AlertLogEntity;
import com.volumemonitor.entity.TradeLogEntity;
import com.volumemonitor.entity.VolumeLogEntity;
import com.volumemonitor.exception.GlobalExceptionHandler;
import com.volumemonitor.mapper.MonitoringDtoMapper;
import com.volumemonitor.service.MonitoringLogService;
import com.volumemonitor.trading.AutoTradeService;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the LogController.
 */
@ExtendWith(MockitoExtension.class)
class LogControllerTest {

    private MockMvc mockMvc;

    @Mock
    private MonitoringLogService monitoringLogService;

    @Mock
    private AutoTradeService autoTradeService;

    @Mock
    private MonitoringDtoMapper monitoringDtoMapper;

    @BeforeEach
    void setUp() {
        LogController controller = new LogController(monitoringLogService, autoTradeService, monitoringDtoMapper);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/logs/volume defaults the limit to 100")
    void volumeDefaultLimit() throws Exception {
        List<VolumeLogEntity> rows = List.of(VolumeLogEntity.builder().id(7L).symbol("RELIANCE").build());
        when(monitoringLogService.getRecentVolumeLogs(null, 100)).thenReturn(rows);
        when(monitoringDtoMapper.toVolumeLogResponseList(rows))
                .thenReturn(List.of(VolumeLogResponse.builder()
                        .id(7L)
                        .symbol("RELIANCE")
                        .totalBuyQty(125000)
                        .totalSellQty(98000)
                        .alertTriggered(true)
                        .build()));

        mockMvc.perform(get("/api/logs/volume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].symbol").value("RELIANCE"))
                .andExpect(jsonPath("$.data[0].totalBuyQty").value(125000))
                .andExpect(jsonPath("$.data[0].alertTriggered").value(true));
    }

    @Test
    @DisplayName("GET /api/logs/volume passes symbol and limit through")
    void volumeFiltered() throws Exception {
        when(monitoringLogService.getRecentVolumeLogs("TCS", 20)).thenReturn(List.of());
        when(monitoringDtoMapper.toVolumeLogResponseList(List.of())).thenReturn(List.of());

        mockMvc.perform(get("/api/logs/volume").param("symbol", "TCS").param("limit", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(0));

        verify(monitoringLogService).getRecentVolumeLogs("TCS", 20);
    }

    @Test
    @DisplayName("a non-numeric limit returns 400")
    void volumeBadLimit() throws Exception {
        mockMvc.perform(get("/api/logs/volume").param("limit", "lots"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Invalid value for parameter: limit"));
    }

    @Test
    @DisplayName("GET /api/logs/alerts/today returns today's alerts")
    void todayAlerts() throws Exception {
        List<AlertLogEntity> alerts = List.of(AlertLogEntity.builder()
                .id(3L)
                .symbol("INFY")
                .alertKind(AlertKind.BUY_SPIKE)
                .volumeLogId(101L)
                .build());
        when(monitoringLogService.getTodayAlerts()).thenReturn(alerts);
        when(monitoringDtoMapper.toAlertLogResponseList(alerts))
                .thenReturn(List.of(AlertLogResponse.builder()
                        .id(3L)
                        .symbol("INFY")
                        .alertKind("BUY_SPIKE")
                        .message("TBQ Spike")
                        .volumeLogId(101L)
                        .build()));

        mockMvc.perform(get("/api/logs/alerts/today"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].alertKind").value("BUY_SPIKE"))
                .andExpect(jsonPath("$.data[0].volumeLogId").value(101));
    }

    @Test
    @DisplayName("GET /api/logs/trades defaults the limit to 50")
    void recentTrades() throws Exception {
        List<TradeLogEntity> trades = List.of(TradeLogEntity.builder().id(9L).symbol("RELIANCE").build());
        when(autoTradeService.getRecentTrades(50)).thenReturn(trades);
        when(monitoringDtoMapper.toTradeLogResponseList(trades))
                .thenReturn(List.of(TradeLogResponse.builder()
                        .id(9L)
                        .symbol("RELIANCE")
                        .side("BUY")
                        .quantity(1)
                        .price(new BigDecimal("2932.70"))
                        .status("PLACED")
                        .brokerOrderId("240101000000001")
                        .build()));

        mockMvc.perform(get("/api/logs/trades"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].status").value("PLACED"))
                .andExpect(jsonPath("$.data[0].price").value(2932.70))
                .andExpect(jsonPath("$.data[0].brokerOrderId").value("240101000000001"));
    }
}
