package com.workflowtrader.domain.enums;

public enum FuturesOrderType {
    MARKET,
    LIMIT
}
