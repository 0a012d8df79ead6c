package com.volumemonitor.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertLogResponse {

    private Long id;
    private LocalDateTime timestamp;
    private String symbol;
    private String message;
    private String alertKind;
    private Long volumeLogId;
}
