package com.workflowtrader.exchange;

import com.workflowtrader.domain.enums.MarginMode;
import com.workflowtrader.exchange.model.FuturesPositionRequest;
import com.workflowtrader.exchange.model.FuturesStopRequest;
import com.workflowtrader.exchange.model.FuturesWallet;

/** Signed USDT-margined perpetual operations. */
public interface FuturesTradingModule {

    FuturesWallet fetchWallet(String userId);

    void setMarginMode(String userId, String symbol, MarginMode marginMode);

    void setLeverage(String userId, String symbol, int leverage);

    void openPosition(String userId, FuturesPositionRequest request);

    void setStopLoss(String userId, FuturesStopRequest request);

    void setTakeProfit(String userId, FuturesStopRequest request);
}
