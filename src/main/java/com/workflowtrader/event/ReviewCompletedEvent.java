package com.workflowtrader.event;

import org.springframework.context.ApplicationEvent;

/** Published once at the end of every review run, successful or failed. */
public class ReviewCompletedEvent extends ApplicationEvent {

    private final Long workflowId;
    private final Long reviewResultId;
    private final boolean success;
    private final boolean rebalance;
    private final long durationMillis;

    public ReviewCompletedEvent(
            Object source,
            Long workflowId,
            Long reviewResultId,
            boolean success,
            boolean rebalance,
            long durationMillis) {
        super(source);
        this.workflowId = workflowId;
        this.reviewResultId = reviewResultId;
        this.success = success;
        this.rebalance = rebalance;
        this.durationMillis = durationMillis;
    }

    public Long getWorkflowId() {
        return workflowId;
    }

    public Long getReviewResultId() {
        return reviewResultId;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isRebalance() {
        return rebalance;
    }

    public long getDurationMillis() {
        return durationMillis;
    }
}
