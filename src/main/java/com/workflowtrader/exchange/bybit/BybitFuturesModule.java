package com.workflowtrader.exchange.bybit;

import com.fasterxml.jackson.databind.JsonNode;
import com.workflowtrader.domain.enums.FuturesOrderType;
import com.workflowtrader.domain.enums.MarginMode;
import com.workflowtrader.domain.enums.PositionSide;
import com.workflowtrader.exchange.FuturesTradingModule;
import com.workflowtrader.exchange.model.FuturesPositionRequest;
import com.workflowtrader.exchange.model.FuturesStopRequest;
import com.workflowtrader.exchange.model.FuturesWallet;
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
import org.springframework.stereotype.Component;

/**
 * Bybit v5 linear perpetual operations.
 *
 * <p>Position index encoding depends on margin mode:
 * <ul>
 *   <li>ISOLATED: one-way mode, {@code positionIdx} omitted</li>
 *   <li>CROSS or unset: hedge mode, {@code positionIdx} 1 for LONG and 2 for SHORT</li>
 * </ul>
 */
@Component
public class BybitFuturesModule implements FuturesTradingModule {

    private static final Logger log = LoggerFactory.getLogger(BybitFuturesModule.class);

    private static final String CATEGORY = "linear";

    private final BybitApiClient apiClient;

    public BybitFuturesModule(BybitApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    public FuturesWallet fetchWallet(String userId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("accountType", "UNIFIED");
        JsonNode list = apiClient.signedGet("/v5/account/wallet-balance", userId, params).path("list");
        if (!list.isArray() || list.isEmpty()) {
            return FuturesWallet.builder().accountType("UNIFIED").coins(List.of()).build();
        }

        JsonNode entry = list.get(0);
        List<FuturesWallet.Coin> coins = new ArrayList<>();
        for (JsonNode coin : entry.path("coin")) {
            coins.add(FuturesWallet.Coin.builder()
                    .asset(coin.path("coin").asText())
                    .walletBalance(decimal(coin.path("walletBalance")))
                    .availableBalance(decimal(coin.path("availableToWithdraw")))
                    .unrealizedPnl(decimal(coin.path("unrealisedPnl")))
                    .build());
        }
        return FuturesWallet.builder()
                .accountType(entry.path("accountType").asText("UNIFIED"))
                .totalWalletBalance(decimal(entry.path("totalWalletBalance")))
                .totalAvailableBalance(decimal(entry.path("totalAvailableBalance")))
                .coins(coins)
                .build();
    }

    @Override
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    public void setMarginMode(String userId, String symbol, MarginMode marginMode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("setMarginMode", marginMode == MarginMode.ISOLATED ? "ISOLATED_MARGIN" : "REGULAR_MARGIN");
        apiClient.signedPost("/v5/account/set-margin-mode", userId, body);
        log.info("Bybit margin mode set: userId={}, symbol={}, marginMode={}", userId, symbol, marginMode);
    }

    @Override
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    public void setLeverage(String userId, String symbol, int leverage) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", CATEGORY);
        body.put("symbol", symbol.toUpperCase(Locale.ROOT));
        body.put("buyLeverage", String.valueOf(leverage));
        body.put("sellLeverage", String.valueOf(leverage));
        apiClient.signedPost("/v5/position/set-leverage", userId, body);
    }

    @Override
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    public void openPosition(String userId, FuturesPositionRequest request) {
        FuturesOrderType type = request.getType() != null ? request.getType() : FuturesOrderType.MARKET;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", CATEGORY);
        body.put("symbol", request.getSymbol().toUpperCase(Locale.ROOT));
        body.put(
                "side",
                request.isReduceOnly() ? closeSide(request.getPositionSide()) : openSide(request.getPositionSide()));
        body.put("orderType", type == FuturesOrderType.LIMIT ? "Limit" : "Market");
        body.put("qty", request.getQuantity().toPlainString());
        putPositionIndex(body, request.getPositionSide(), request.getMarginMode());
        if (type == FuturesOrderType.LIMIT) {
            body.put("price", request.getPrice().toPlainString());
            body.put("timeInForce", "GTC");
        }
        if (request.isReduceOnly()) {
            body.put("reduceOnly", true);
        }
        apiClient.signedPost("/v5/order/create", userId, body);
        log.info(
                "Bybit futures order sent: userId={}, symbol={}, positionSide={}, type={}, qty={}, reduceOnly={}",
                userId,
                request.getSymbol(),
                request.getPositionSide(),
                type,
                request.getQuantity(),
                request.isReduceOnly());
    }

    @Override
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    public void setStopLoss(String userId, FuturesStopRequest request) {
        apiClient.signedPost("/v5/position/trading-stop", userId, tradingStop(request, "stopLoss", "slTriggerBy"));
    }

    @Override
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    public void setTakeProfit(String userId, FuturesStopRequest request) {
        apiClient.signedPost("/v5/position/trading-stop", userId, tradingStop(request, "takeProfit", "tpTriggerBy"));
    }

    private static Map<String, Object> tradingStop(FuturesStopRequest request, String field, String triggerField) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", CATEGORY);
        body.put("symbol", request.getSymbol().toUpperCase(Locale.ROOT));
        body.put(field, request.getStopPrice().toPlainString());
        body.put(triggerField, "LastPrice");
        putPositionIndex(body, request.getPositionSide(), request.getMarginMode());
        return body;
    }

    static void putPositionIndex(Map<String, Object> body, PositionSide positionSide, MarginMode marginMode) {
        if (marginMode == MarginMode.ISOLATED) {
            return;
        }
        body.put("positionIdx", positionSide == PositionSide.LONG ? 1 : 2);
    }

    private static String openSide(PositionSide positionSide) {
        return positionSide == PositionSide.LONG ? "Buy" : "Sell";
    }

    private static String closeSide(PositionSide positionSide) {
        return positionSide == PositionSide.LONG ? "Sell" : "Buy";
    }

    private static BigDecimal decimal(JsonNode node) {
        String text = node.asText("");
        return text.isBlank() ? BigDecimal.ZERO : new BigDecimal(text);
    }
}
