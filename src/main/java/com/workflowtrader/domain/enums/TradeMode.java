package com.workflowtrader.domain.enums;

public enum TradeMode {
    SPOT,
    FUTURES
}
