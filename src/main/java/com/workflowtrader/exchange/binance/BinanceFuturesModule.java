package com.workflowtrader.exchange.binance;

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
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

/**
 * Binance USD-M futures operations on {@code /fapi}.
 *
 * <p>Orders are sent with an explicit {@code positionSide}, which assumes the account runs in
 * hedge mode. Stops are {@code STOP_MARKET} / {@code TAKE_PROFIT_MARKET} with
 * {@code closePosition=true} on the closing side.
 */
@Component
public class BinanceFuturesModule implements FuturesTradingModule {

    private static final Logger log = LoggerFactory.getLogger(BinanceFuturesModule.class);

    private final BinanceApiClient apiClient;

    public BinanceFuturesModule(BinanceApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public FuturesWallet fetchWallet(String userId) {
        JsonNode balances = apiClient.signed(BinanceApi.FUTURES, HttpMethod.GET, "/fapi/v2/balance", userId, Map.of());
        List<FuturesWallet.Coin> coins = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal available = BigDecimal.ZERO;
        if (balances != null) {
            for (JsonNode balance : balances) {
                FuturesWallet.Coin coin = FuturesWallet.Coin.builder()
                        .asset(balance.path("asset").asText())
                        .walletBalance(new BigDecimal(balance.path("balance").asText("0")))
                        .availableBalance(new BigDecimal(balance.path("availableBalance").asText("0")))
                        .unrealizedPnl(new BigDecimal(balance.path("crossUnPnl").asText("0")))
                        .build();
                if (coin.getWalletBalance().signum() == 0) {
                    continue;
                }
                coins.add(coin);
                total = total.add(coin.getWalletBalance());
                available = available.add(coin.getAvailableBalance());
            }
        }
        return FuturesWallet.builder()
                .accountType("USDM")
                .totalWalletBalance(total)
                .totalAvailableBalance(available)
                .coins(coins)
                .build();
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public void setMarginMode(String userId, String symbol, MarginMode marginMode) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol.toUpperCase(Locale.ROOT));
        params.put("marginType", marginMode == MarginMode.ISOLATED ? "ISOLATED" : "CROSSED");
        apiClient.signed(BinanceApi.FUTURES, HttpMethod.POST, "/fapi/v1/marginType", userId, params);
        log.info("Binance margin mode set: userId={}, symbol={}, marginMode={}", userId, symbol, marginMode);
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public void setLeverage(String userId, String symbol, int leverage) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol.toUpperCase(Locale.ROOT));
        params.put("leverage", String.valueOf(leverage));
        apiClient.signed(BinanceApi.FUTURES, HttpMethod.POST, "/fapi/v1/leverage", userId, params);
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public void openPosition(String userId, FuturesPositionRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", request.getSymbol().toUpperCase(Locale.ROOT));
        params.put(
                "side",
                request.isReduceOnly() ? closeSide(request.getPositionSide()) : openSide(request.getPositionSide()));
        params.put("positionSide", request.getPositionSide().name());
        FuturesOrderType type = request.getType() != null ? request.getType() : FuturesOrderType.MARKET;
        params.put("type", type.name());
        params.put("quantity", request.getQuantity().toPlainString());
        if (type == FuturesOrderType.LIMIT) {
            params.put("price", request.getPrice().toPlainString());
            params.put("timeInForce", "GTC");
        }
        apiClient.signed(BinanceApi.FUTURES, HttpMethod.POST, "/fapi/v1/order", userId, params);
        log.info(
                "Binance futures order sent: userId={}, symbol={}, positionSide={}, type={}, qty={}, reduceOnly={}",
                userId,
                request.getSymbol(),
                request.getPositionSide(),
                type,
                request.getQuantity(),
                request.isReduceOnly());
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public void setStopLoss(String userId, FuturesStopRequest request) {
        apiClient.signed(
                BinanceApi.FUTURES, HttpMethod.POST, "/fapi/v1/order", userId, stopParams(request, "STOP_MARKET"));
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public void setTakeProfit(String userId, FuturesStopRequest request) {
        apiClient.signed(
                BinanceApi.FUTURES,
                HttpMethod.POST,
                "/fapi/v1/order",
                userId,
                stopParams(request, "TAKE_PROFIT_MARKET"));
    }

    private static Map<String, String> stopParams(FuturesStopRequest request, String type) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", request.getSymbol().toUpperCase(Locale.ROOT));
        params.put("side", closeSide(request.getPositionSide()));
        params.put("positionSide", request.getPositionSide().name());
        params.put("type", type);
        params.put("stopPrice", request.getStopPrice().toPlainString());
        params.put("closePosition", "true");
        return params;
    }

    private static String openSide(PositionSide positionSide) {
        return positionSide == PositionSide.LONG ? "BUY" : "SELL";
    }

    private static String closeSide(PositionSide positionSide) {
        return positionSide == PositionSide.LONG ? "SELL" : "BUY";
    }
}
