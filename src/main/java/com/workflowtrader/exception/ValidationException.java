package com.workflowtrader.exception;

import java.util.Map;

/**
 * Raised for a malformed decision, order shape or request. Recorded by the caller;
 * no exchange call is issued for the offending item.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
