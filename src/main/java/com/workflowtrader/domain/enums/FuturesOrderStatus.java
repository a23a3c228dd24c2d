package com.workflowtrader.domain.enums;

/** Futures action outcome. Every value is terminal; there is no open state. */
public enum FuturesOrderStatus {
    EXECUTED,
    FAILED,
    SKIPPED
}
