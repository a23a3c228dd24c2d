package com.workflowtrader.domain.enums;

public enum FuturesActionType {
    OPEN,
    CLOSE,
    SCALE,
    HOLD
}
