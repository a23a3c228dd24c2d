package com.workflowtrader.exception;

/**
 * Transport-level failure talking to the decision model (HTTP error, timeout, empty body).
 * A response that arrives but fails schema validation is not an error; it is "no decision".
 */
public class DecisionAgentException extends BaseException {

    public DecisionAgentException(String message) {
        super(ErrorCode.DECISION_AGENT_ERROR, message);
    }

    public DecisionAgentException(String message, Throwable cause) {
        super(ErrorCode.DECISION_AGENT_ERROR, message, cause);
    }
}
