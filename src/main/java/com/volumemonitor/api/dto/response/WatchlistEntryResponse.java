package com.volumemonitor.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One symbol on the persisted watchlist. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WatchlistEntryResponse {

    private Long id;
    private String symbol;
    private String instrumentType;
    private LocalDateTime createdAt;
}
