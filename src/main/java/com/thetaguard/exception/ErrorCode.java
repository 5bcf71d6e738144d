package com.thetaguard.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_STATE_TRANSITION("INVALID_STATE_TRANSITION", 409),
    POLICY_VIOLATION("POLICY_VIOLATION", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    DATA_UNAVAILABLE("DATA_UNAVAILABLE", 503),
    DECISION_CORE_HALTED("DECISION_CORE_HALTED", 503);

    private final String code;
    private final int httpStatus;
}
