package com.volumemonitor.entity;

import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.enums.OrderSide;
import com.volumemonitor.domain.enums.OrderType;
import com.volumemonitor.domain.enums.TradeStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trade_logs table.
 *
 * <p>Every auto-trade attempt is recorded, including the ones that never reached the broker
 * (BLOCKED by the budget cap). The alert is identified by symbol, kind, and the tick time it
 * fired at.
 */
@Entity
@Table(name = "trade_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(nullable = false, length = 50)
    private String symbol;

    @Column(length = 10)
    private String exchange;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, columnDefinition = "varchar(10)")
    private OrderSide side;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", nullable = false, columnDefinition = "varchar(10)")
    private OrderType orderType;

    private int quantity;

    @Column(precision = 15, scale = 2)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, columnDefinition = "varchar(10)")
    private TradeStatus status;

    @Column(name = "broker_order_id", length = 50)
    private String brokerOrderId;

    @Column(name = "status_message", columnDefinition = "TEXT")
    private String statusMessage;

    /** With {@code symbol} and {@code alertTime}, matches the alert_logs row that triggered this trade. */
    @Enumerated(EnumType.STRING)
    @Column(name = "alert_kind", columnDefinition = "varchar(20)")
    private AlertKind alertKind;

    /** Evaluation time of the tick that raised the alert; equals alert_logs.timestamp. */
    @Column(name = "alert_time")
    private LocalDateTime alertTime;
}
