package com.workflowtrader.domain.enums;

/** Spot limit order status. FILLED and CANCELED are terminal. */
public enum LimitOrderStatus {
    OPEN,
    FILLED,
    CANCELED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
