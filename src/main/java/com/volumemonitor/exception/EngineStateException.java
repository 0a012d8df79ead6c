package com.volumemonitor.exception;

import com.volumemonitor.domain.enums.MonitoringStatus;
import java.util.Map;

public class EngineStateException extends BaseException {

    public EngineStateException(String message, MonitoringStatus currentStatus) {
        super(ErrorCode.ENGINE_STATE_CONFLICT, message, Map.of("status", currentStatus.name()));
    }
}
