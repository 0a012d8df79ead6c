package com.volumemonitor.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 400),
    UNAUTHORIZED("UNAUTHORIZED", 401),
    NOT_FOUND("NOT_FOUND", 404),
    ENGINE_STATE_CONFLICT("ENGINE_STATE_CONFLICT", 409),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    BROKER_ERROR("BROKER_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
