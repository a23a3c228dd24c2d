package com.workflowtrader.domain.enums;

public enum OrderSide {
    BUY,
    SELL
}
