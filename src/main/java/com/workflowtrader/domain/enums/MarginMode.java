package com.workflowtrader.domain.enums;

public enum MarginMode {
    CROSS,
    ISOLATED
}
