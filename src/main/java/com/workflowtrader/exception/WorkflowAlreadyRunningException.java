package com.workflowtrader.exception;

import java.util.Map;

/**
 * Returned to a manual trigger when the workflow already has a review in flight.
 * Scheduled triggers never see this; they skip held workflows silently.
 */
public class WorkflowAlreadyRunningException extends BaseException {

    public WorkflowAlreadyRunningException(Long workflowId) {
        super(
                ErrorCode.WORKFLOW_ALREADY_RUNNING,
                "Agent is already reviewing portfolio",
                Map.of("workflowId", workflowId));
    }
}
