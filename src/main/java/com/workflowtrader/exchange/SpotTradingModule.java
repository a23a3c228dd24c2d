package com.workflowtrader.exchange;

import com.workflowtrader.exchange.model.ExchangeOrderState;
import com.workflowtrader.exchange.model.SpotBalance;
import com.workflowtrader.exchange.model.SpotOpenOrder;
import com.workflowtrader.exchange.model.SpotOrderRequest;
import java.util.List;

/**
 * Signed spot account operations, executed with the user's stored exchange key.
 * Rejections surface as {@link com.workflowtrader.exception.ExchangeException}.
 */
public interface SpotTradingModule {

    List<SpotBalance> fetchBalances(String userId);

    ExchangeOrderState placeLimitOrder(String userId, SpotOrderRequest request);

    ExchangeOrderState cancelOrder(String userId, String symbol, String orderId);

    List<SpotOpenOrder> fetchOpenOrders(String userId, String symbol);

    ExchangeOrderState fetchOrder(String userId, String symbol, String orderId);
}
