package com.volumemonitor.entity;

import com.volumemonitor.domain.enums.InstrumentType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the volume_logs table.
 *
 * <p>One row per evaluated symbol per tick: the quote, the TBQ/TSQ changes against baseline,
 * the running day extremes, and whether the tick fired an alert or promoted a new baseline.
 * Alert rows in the alerts table point back to the row of the tick that fired them.
 */
@Entity
@Table(
        name = "volume_logs",
        indexes = {@Index(name = "idx_volume_logs_symbol_ts", columnList = "symbol, timestamp")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VolumeLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(nullable = false, length = 50)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "instrument_type", columnDefinition = "varchar(10)")
    private InstrumentType instrumentType;

    @Column(name = "last_price", precision = 15, scale = 2)
    private BigDecimal lastPrice;

    @Column(name = "open_price", precision = 15, scale = 2)
    private BigDecimal openPrice;

    @Column(name = "high_price", precision = 15, scale = 2)
    private BigDecimal highPrice;

    @Column(name = "low_price", precision = 15, scale = 2)
    private BigDecimal lowPrice;

    @Column(name = "close_price", precision = 15, scale = 2)
    private BigDecimal closePrice;

    @Column(name = "total_buy_qty")
    private long totalBuyQty;

    @Column(name = "total_sell_qty")
    private long totalSellQty;

    @Column(name = "buy_change_pct")
    private double buyChangePct;

    @Column(name = "sell_change_pct")
    private double sellChangePct;

    private double ratio;

    @Column(name = "day_high_buy_qty")
    private Long dayHighBuyQty;

    @Column(name = "day_low_buy_qty")
    private Long dayLowBuyQty;

    @Column(name = "day_high_sell_qty")
    private Long dayHighSellQty;

    @Column(name = "day_low_sell_qty")
    private Long dayLowSellQty;

    @Column(name = "alert_triggered", nullable = false)
    private boolean alertTriggered;

    @Column(name = "new_baseline", nullable = false)
    private boolean newBaseline;
}
