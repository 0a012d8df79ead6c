package com.volumemonitor.api.dto.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Catalog entry returned by instrument search. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InstrumentResponse {

    private String symbol;
    private String name;
    private String instrumentType;
    private String exchange;
    private long token;
    private LocalDate expiry;
    private BigDecimal strike;
    private int lotSize;
}
