package com.workflowtrader.exception;

import java.util.Map;

/**
 * Raised when a workflow lacks its model, AI key or exchange key. Aborts the review
 * run before any exchange call is made.
 */
public class CredentialException extends BaseException {

    public CredentialException(String message, Map<String, Object> details) {
        super(ErrorCode.CREDENTIAL_ERROR, message, details);
    }
}
