package com.workflowtrader.domain.enums;

/**
 * Lifecycle of a workflow. Only ACTIVE workflows are picked up by the review scheduler,
 * and open orders owned by a non-ACTIVE workflow are canceled by the reconciler.
 */
public enum WorkflowStatus {
    DRAFT,
    ACTIVE,
    INACTIVE,
    RETIRED
}
