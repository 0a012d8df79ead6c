package com.volumemonitor.service;

import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.model.DailyExtremes;
import com.volumemonitor.domain.model.QuoteSnapshot;
import com.volumemonitor.domain.model.SymbolResult;
import com.volumemonitor.entity.AlertLogEntity;
import com.volumemonitor.entity.VolumeLogEntity;
import com.volumemonitor.event.MonitoringBatchEvent;
import com.volumemonitor.repository.jpa.AlertLogJpaRepository;
import com.volumemonitor.repository.jpa.VolumeLogJpaRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists every evaluated tick to H2 and serves the log queries behind the logs API.
 *
 * <p>Each {@link SymbolResult} becomes one volume_logs row. Each alert kind fired in that tick
 * becomes one alerts row pointing at the volume log row it came from, so an alert can always be
 * traced back to the exact order-book numbers that triggered it.
 *
 * <p>Runs on the eventExecutor so database writes never hold up the polling thread.
 */
@Service
public class MonitoringLogService {

    private static final Logger log = LoggerFactory.getLogger(MonitoringLogService.class);

    public static final int MAX_LIMIT = 1000;

    private final VolumeLogJpaRepository volumeLogJpaRepository;
    private final AlertLogJpaRepository alertLogJpaRepository;
    private final Clock clock;

    public MonitoringLogService(
            VolumeLogJpaRepository volumeLogJpaRepository, AlertLogJpaRepository alertLogJpaRepository, Clock clock) {
        this.volumeLogJpaRepository = volumeLogJpaRepository;
        this.alertLogJpaRepository = alertLogJpaRepository;
        this.clock = clock;
    }

    @Async("eventExecutor")
    @EventListener
    @Transactional
    public void onBatch(MonitoringBatchEvent event) {
        int alerts = 0;
        for (SymbolResult result : event.getResults()) {
            VolumeLogEntity volumeLog = volumeLogJpaRepository.save(toVolumeLog(result));
            if (!result.isAlertTriggered()) {
                continue;
            }
            String message = describeAlerts(result.getFiredAlertKinds());
            for (AlertKind kind : result.getFiredAlertKinds()) {
                alertLogJpaRepository.save(AlertLogEntity.builder()
                        .timestamp(result.getEvaluatedAt())
                        .symbol(result.getSymbol())
                        .message(message)
                        .alertKind(kind)
                        .volumeLogId(volumeLog.getId())
                        .build());
                alerts++;
            }
        }
        log.debug("Logged {} volume rows and {} alerts", event.getResults().size(), alerts);
    }

    /**
     * Most recent volume log rows, newest first.
     *
     * @param symbol optional symbol filter, null or blank for all symbols
     * @param limit maximum rows, clamped to 1..{@value #MAX_LIMIT}
     */
    public List<VolumeLogEntity> getRecentVolumeLogs(String symbol, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIMIT)));
        if (symbol == null || symbol.isBlank()) {
            return volumeLogJpaRepository.findAllByOrderByTimestampDesc(page);
        }
        return volumeLogJpaRepository.findBySymbolOrderByTimestampDesc(symbol.trim().toUpperCase(Locale.ROOT), page);
    }

    public List<AlertLogEntity> getTodayAlerts() {
        LocalDate today = LocalDate.now(clock);
        return alertLogJpaRepository.findByDateRange(today.atStartOfDay(), today.plusDays(1).atStartOfDay());
    }

    public long getTodayAlertCount() {
        LocalDate today = LocalDate.now(clock);
        return alertLogJpaRepository.countByTimestampGreaterThanEqualAndTimestampLessThan(
                today.atStartOfDay(), today.plusDays(1).atStartOfDay());
    }

    /** "TBQ Spike", or "TBQ Spike & TSQ Spike" when both sides fired in the same tick. */
    static String describeAlerts(List<AlertKind> kinds) {
        return kinds.stream().map(AlertKind::getLabel).collect(Collectors.joining(" & "));
    }

    private VolumeLogEntity toVolumeLog(SymbolResult result) {
        QuoteSnapshot snapshot = result.getSnapshot();
        DailyExtremes extremes = result.getDailyExtremes() != null ? result.getDailyExtremes() : DailyExtremes.EMPTY;
        LocalDateTime timestamp = result.getEvaluatedAt();
        return VolumeLogEntity.builder()
                .timestamp(timestamp)
                .symbol(result.getSymbol())
                .instrumentType(result.getInstrument().getInstrumentType())
                .lastPrice(snapshot.getLastPrice())
                .openPrice(snapshot.getOpen())
                .highPrice(snapshot.getHigh())
                .lowPrice(snapshot.getLow())
                .closePrice(snapshot.getClose())
                .totalBuyQty(snapshot.getBuyQuantity())
                .totalSellQty(snapshot.getSellQuantity())
                .buyChangePct(result.getBuyChangePercent())
                .sellChangePct(result.getSellChangePercent())
                .ratio(result.getRatio())
                .dayHighBuyQty(extremes.getMaxBuyQty())
                .dayLowBuyQty(extremes.getMinBuyQty())
                .dayHighSellQty(extremes.getMaxSellQty())
                .dayLowSellQty(extremes.getMinSellQty())
                .alertTriggered(result.isAlertTriggered())
                .newBaseline(result.isNewBaseline())
                .build();
    }
}
