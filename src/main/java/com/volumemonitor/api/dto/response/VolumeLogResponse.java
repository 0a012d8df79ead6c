package com.volumemonitor.api.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One logged tick for one symbol. Change percentages and ratio are fractions (0.05 = 5%).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VolumeLogResponse {

    private Long id;
    private LocalDateTime timestamp;
    private String symbol;
    private String instrumentType;
    private BigDecimal lastPrice;
    private BigDecimal openPrice;
    private BigDecimal highPrice;
    private BigDecimal lowPrice;
    private BigDecimal closePrice;
    private long totalBuyQty;
    private long totalSellQty;
    private double buyChangePct;
    private double sellChangePct;
    private double ratio;
    private Long dayHighBuyQty;
    private Long dayLowBuyQty;
    private Long dayHighSellQty;
    private Long dayLowSellQty;
    private boolean alertTriggered;
    private boolean newBaseline;
}
