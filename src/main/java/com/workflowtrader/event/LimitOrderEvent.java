package com.workflowtrader.event;

import com.workflowtrader.domain.enums.LimitOrderStatus;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a limit order row is created or changes status.
 *
 * <p>{@code previousStatus} is null for newly recorded orders. Events are only published for
 * writes that actually changed a row, so a reconciliation sweep that finds nothing to do
 * publishes nothing.
 */
public class LimitOrderEvent extends ApplicationEvent {

    private final Long limitOrderId;
    private final Long workflowId;
    private final LimitOrderStatus status;
    private final LimitOrderStatus previousStatus;
    private final String reason;

    public LimitOrderEvent(
            Object source,
            Long limitOrderId,
            Long workflowId,
            LimitOrderStatus status,
            LimitOrderStatus previousStatus,
            String reason) {
        super(source);
        this.limitOrderId = limitOrderId;
        this.workflowId = workflowId;
        this.status = status;
        this.previousStatus = previousStatus;
        this.reason = reason;
    }

    public Long getLimitOrderId() {
        return limitOrderId;
    }

    public Long getWorkflowId() {
        return workflowId;
    }

    public LimitOrderStatus getStatus() {
        return status;
    }

    public LimitOrderStatus getPreviousStatus() {
        return previousStatus;
    }

    public String getReason() {
        return reason;
    }
}
