package com.workflowtrader.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Exchanges a workflow can trade on. Each carries the exchange-specific error code that
 * means "the referenced order does not exist", which reconciliation treats as a cancellation.
 */
@Getter
@RequiredArgsConstructor
public enum SupportedExchange {
    BINANCE("Binance", -2013),
    BYBIT("Bybit", 110001);

    private final String displayName;
    private final int orderNotFoundCode;
}
