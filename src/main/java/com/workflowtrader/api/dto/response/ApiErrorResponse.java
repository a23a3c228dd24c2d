package com.workflowtrader.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.workflowtrader.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body for every failed API call: {@code {"success": false, "error": {...}}}.
 *
 * <p>{@code retryable} tells the client whether the same request can succeed later without
 * changes (a review already running, a saturated executor, an unreachable exchange).
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .retryable(errorCode.isRetryable())
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final boolean retryable;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
