package com.workflowtrader.exchange.binance;

/** Binance REST host a request is sent to. */
public enum BinanceApi {
    SPOT,
    FUTURES
}
