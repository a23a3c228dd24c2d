package com.workflowtrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    WORKFLOW_ALREADY_RUNNING("WORKFLOW_ALREADY_RUNNING", 409),
    CREDENTIAL_ERROR("CREDENTIAL_ERROR", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    EXCHANGE_ERROR("EXCHANGE_ERROR", 502),
    DECISION_AGENT_ERROR("DECISION_AGENT_ERROR", 502),
    EXCHANGE_UNAVAILABLE("EXCHANGE_UNAVAILABLE", 503),
    SERVICE_BUSY("SERVICE_BUSY", 503);

    private final String code;
    private final int httpStatus;

    /** Codes where repeating the same request later can succeed. */
    public boolean isRetryable() {
        return this == WORKFLOW_ALREADY_RUNNING || this == SERVICE_BUSY || this == EXCHANGE_UNAVAILABLE;
    }
}
