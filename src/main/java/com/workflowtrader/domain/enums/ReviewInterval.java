package com.workflowtrader.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How often a workflow is reviewed. Each interval maps to a Spring 6-field cron
 * expression registered by the review scheduler.
 */
@Getter
@RequiredArgsConstructor
public enum ReviewInterval {
    M10("10m", "0 */10 * * * *"),
    M15("15m", "0 */15 * * * *"),
    M30("30m", "0 */30 * * * *"),
    H1("1h", "0 0 * * * *"),
    H3("3h", "0 0 */3 * * *"),
    H5("5h", "0 0 */5 * * *"),
    H12("12h", "0 0 */12 * * *"),
    H24("24h", "0 0 0 * * *"),
    D3("3d", "0 0 0 */3 * *"),
    W1("1w", "0 0 0 * * MON");

    private final String code;
    private final String cron;
}
