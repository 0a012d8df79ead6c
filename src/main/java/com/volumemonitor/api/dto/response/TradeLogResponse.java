package com.volumemonitor.api.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One auto-trade attempt and its outcome (PLACED, REJECTED or BLOCKED). */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeLogResponse {

    private Long id;
    private LocalDateTime timestamp;
    private String symbol;
    private String exchange;
    private String side;
    private String orderType;
    private int quantity;
    private BigDecimal price;
    private String status;
    private String brokerOrderId;
    private String statusMessage;
    private String alertKind;
    private LocalDateTime alertTime;
}
