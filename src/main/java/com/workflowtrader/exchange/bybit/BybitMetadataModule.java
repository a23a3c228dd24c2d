package com.workflowtrader.exchange.bybit;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.exception.ExchangeException;
import com.workflowtrader.exchange.MarketMetadataModule;
import com.workflowtrader.exchange.model.Candle;
import com.workflowtrader.exchange.model.SpotMarket;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * Bybit v5 market data for the {@code linear} (USDT perpetual) category.
 *
 * <p>Bybit returns klines newest first; they are reversed so callers always get oldest first.
 */
@Component
public class BybitMetadataModule implements MarketMetadataModule {

    private static final String CATEGORY = "linear";

    private final BybitApiClient apiClient;

    /** Caffeine cache: key = symbol, value = SpotMarket, 10min TTL. */
    private final Cache<String, SpotMarket> marketCache;

    public BybitMetadataModule(BybitApiClient apiClient) {
        this.apiClient = apiClient;
        this.marketCache = Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(500)
                .build();
    }

    @Override
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    public SpotMarket fetchMarket(String baseAsset, String quoteAsset) {
        String symbol = (baseAsset + quoteAsset).toUpperCase(Locale.ROOT);
        SpotMarket cached = marketCache.getIfPresent(symbol);
        if (cached != null) {
            return cached;
        }

        JsonNode result = apiClient.publicGet(
                "/v5/market/instruments-info", params("symbol", symbol));
        JsonNode list = result.path("list");
        if (!list.isArray() || list.isEmpty()) {
            throw new ExchangeException(SupportedExchange.BYBIT, null, "Unknown symbol " + symbol);
        }
        JsonNode entry = list.get(0);
        JsonNode priceFilter = entry.path("priceFilter");
        JsonNode lotSize = entry.path("lotSizeFilter");
        SpotMarket market = SpotMarket.builder()
                .symbol(symbol)
                .baseAsset(entry.path("baseCoin").asText(baseAsset))
                .quoteAsset(entry.path("quoteCoin").asText(quoteAsset))
                .pricePrecision(precisionOf(priceFilter.path("tickSize").asText()))
                .quantityPrecision(precisionOf(lotSize.path("qtyStep").asText()))
                .minNotional(new BigDecimal(lotSize.path("minNotionalValue").asText("0")))
                .build();
        marketCache.put(symbol, market);
        return market;
    }

    @Override
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    public BigDecimal fetchTicker(String symbol) {
        JsonNode result = apiClient.publicGet("/v5/market/tickers", params("symbol", symbol.toUpperCase(Locale.ROOT)));
        JsonNode list = result.path("list");
        if (!list.isArray() || list.isEmpty() || !list.get(0).hasNonNull("lastPrice")) {
            throw new ExchangeException(SupportedExchange.BYBIT, null, "No price returned for " + symbol);
        }
        return new BigDecimal(list.get(0).get("lastPrice").asText());
    }

    @Override
    @RateLimiter(name = "bybitApi")
    @CircuitBreaker(name = "bybitApi")
    public List<Candle> fetchKlines(String symbol, String interval, int limit) {
        Map<String, String> query = params("symbol", symbol.toUpperCase(Locale.ROOT));
        query.put("interval", toBybitInterval(interval));
        query.put("limit", String.valueOf(limit));
        JsonNode rows = apiClient.publicGet("/v5/market/kline", query).path("list");

        List<Candle> candles = new ArrayList<>();
        for (int i = rows.size() - 1; i >= 0; i--) {
            JsonNode row = rows.get(i);
            candles.add(Candle.builder()
                    .closeTime(Instant.ofEpochMilli(row.get(0).asLong()))
                    .open(new BigDecimal(row.get(1).asText()))
                    .high(new BigDecimal(row.get(2).asText()))
                    .low(new BigDecimal(row.get(3).asText()))
                    .close(new BigDecimal(row.get(4).asText()))
                    .volume(new BigDecimal(row.get(5).asText()))
                    .build());
        }
        return candles;
    }

    private static Map<String, String> params(String key, String value) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("category", CATEGORY);
        params.put(key, value);
        return params;
    }

    /** Binance-style intervals ("1h", "1d") to Bybit's ("60", "D"). */
    static String toBybitInterval(String interval) {
        return switch (interval) {
            case "1m" -> "1";
            case "5m" -> "5";
            case "15m" -> "15";
            case "30m" -> "30";
            case "1h" -> "60";
            case "4h" -> "240";
            case "1d" -> "D";
            case "1w" -> "W";
            default -> interval;
        };
    }

    private static int precisionOf(String step) {
        if (step == null || step.isBlank()) {
            return 8;
        }
        return Math.max(0, new BigDecimal(step).stripTrailingZeros().scale());
    }
}
