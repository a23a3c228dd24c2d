package com.workflowtrader.domain.enums;

public enum PositionSide {
    LONG,
    SHORT
}
