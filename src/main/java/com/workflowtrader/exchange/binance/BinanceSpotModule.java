package com.workflowtrader.exchange.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.workflowtrader.domain.enums.OrderSide;
import com.workflowtrader.exchange.SpotTradingModule;
import com.workflowtrader.exchange.model.ExchangeOrderState;
import com.workflowtrader.exchange.model.SpotBalance;
import com.workflowtrader.exchange.model.SpotOpenOrder;
import com.workflowtrader.exchange.model.SpotOrderRequest;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

/**
 * Binance spot account operations on {@code /api/v3}.
 *
 * <p>Each method is annotated with Resilience4j decorators:
 * <ul>
 *   <li><b>Rate limiter</b> ({@code binanceApi}): keeps request weight under Binance's per-IP limit</li>
 *   <li><b>Circuit breaker</b> ({@code binanceApi}): opens on transport failures only</li>
 * </ul>
 * Failed calls are not retried; a rejected order is recorded and the next review decides again.
 */
@Component
public class BinanceSpotModule implements SpotTradingModule {

    private static final Logger log = LoggerFactory.getLogger(BinanceSpotModule.class);

    private final BinanceApiClient apiClient;

    public BinanceSpotModule(BinanceApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public List<SpotBalance> fetchBalances(String userId) {
        JsonNode account = apiClient.signed(BinanceApi.SPOT, HttpMethod.GET, "/api/v3/account", userId, Map.of());
        List<SpotBalance> balances = new ArrayList<>();
        if (account == null) {
            return balances;
        }
        for (JsonNode balance : account.path("balances")) {
            balances.add(SpotBalance.builder()
                    .asset(balance.path("asset").asText())
                    .free(new BigDecimal(balance.path("free").asText("0")))
                    .locked(new BigDecimal(balance.path("locked").asText("0")))
                    .build());
        }
        return balances;
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public ExchangeOrderState placeLimitOrder(String userId, SpotOrderRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", request.getSymbol().toUpperCase(Locale.ROOT));
        params.put("side", request.getSide().name());
        params.put("type", "LIMIT");
        params.put("timeInForce", "GTC");
        params.put("quantity", request.getQuantity().toPlainString());
        params.put("price", request.getPrice().toPlainString());

        JsonNode response = apiClient.signed(BinanceApi.SPOT, HttpMethod.POST, "/api/v3/order", userId, params);
        ExchangeOrderState state = toOrderState(response);
        log.info(
                "Binance limit order placed: userId={}, symbol={}, side={}, qty={}, price={}, orderId={}",
                userId,
                request.getSymbol(),
                request.getSide(),
                request.getQuantity(),
                request.getPrice(),
                state.getOrderId());
        return state;
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public ExchangeOrderState cancelOrder(String userId, String symbol, String orderId) {
        JsonNode response = apiClient.signed(
                BinanceApi.SPOT, HttpMethod.DELETE, "/api/v3/order", userId, orderParams(symbol, orderId));
        return toOrderState(response);
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public List<SpotOpenOrder> fetchOpenOrders(String userId, String symbol) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol.toUpperCase(Locale.ROOT));
        JsonNode response = apiClient.signed(BinanceApi.SPOT, HttpMethod.GET, "/api/v3/openOrders", userId, params);
        List<SpotOpenOrder> orders = new ArrayList<>();
        if (response == null) {
            return orders;
        }
        for (JsonNode order : response) {
            orders.add(SpotOpenOrder.builder()
                    .orderId(order.path("orderId").asText())
                    .symbol(order.path("symbol").asText())
                    .side("SELL".equals(order.path("side").asText()) ? OrderSide.SELL : OrderSide.BUY)
                    .price(new BigDecimal(order.path("price").asText("0")))
                    .quantity(new BigDecimal(order.path("origQty").asText("0")))
                    .build());
        }
        return orders;
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public ExchangeOrderState fetchOrder(String userId, String symbol, String orderId) {
        JsonNode response = apiClient.signed(
                BinanceApi.SPOT, HttpMethod.GET, "/api/v3/order", userId, orderParams(symbol, orderId));
        return toOrderState(response);
    }

    private static Map<String, String> orderParams(String symbol, String orderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol.toUpperCase(Locale.ROOT));
        params.put("orderId", orderId);
        return params;
    }

    private static ExchangeOrderState toOrderState(JsonNode response) {
        if (response == null) {
            return ExchangeOrderState.builder().build();
        }
        String orderId = response.hasNonNull("orderId") ? response.get("orderId").asText() : null;
        String status = response.hasNonNull("status") ? response.get("status").asText() : null;
        return ExchangeOrderState.builder().orderId(orderId).status(status).build();
    }
}
