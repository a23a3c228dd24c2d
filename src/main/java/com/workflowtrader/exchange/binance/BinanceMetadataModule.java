package com.workflowtrader.exchange.binance;

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
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * Binance spot market data: exchange info, last price and klines.
 *
 * <p>Symbol rules change rarely, so {@link SpotMarket} lookups are held in a Caffeine cache
 * for 10 minutes. Prices are never cached.
 */
@Component
public class BinanceMetadataModule implements MarketMetadataModule {

    private final BinanceApiClient apiClient;

    /** Caffeine cache: key = symbol, value = SpotMarket, 10min TTL. */
    private final Cache<String, SpotMarket> marketCache;

    public BinanceMetadataModule(BinanceApiClient apiClient) {
        this.apiClient = apiClient;
        this.marketCache = Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(500)
                .build();
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public SpotMarket fetchMarket(String baseAsset, String quoteAsset) {
        String symbol = (baseAsset + quoteAsset).toUpperCase(Locale.ROOT);
        SpotMarket cached = marketCache.getIfPresent(symbol);
        if (cached != null) {
            return cached;
        }

        JsonNode info = apiClient.publicGet(BinanceApi.SPOT, "/api/v3/exchangeInfo", Map.of("symbol", symbol));
        JsonNode symbols = info != null ? info.path("symbols") : null;
        if (symbols == null || !symbols.isArray() || symbols.isEmpty()) {
            throw new ExchangeException(SupportedExchange.BINANCE, null, "Unknown symbol " + symbol);
        }

        JsonNode entry = symbols.get(0);
        SpotMarket.SpotMarketBuilder market = SpotMarket.builder()
                .symbol(entry.path("symbol").asText(symbol))
                .baseAsset(entry.path("baseAsset").asText(baseAsset))
                .quoteAsset(entry.path("quoteAsset").asText(quoteAsset))
                .pricePrecision(entry.path("quotePrecision").asInt(8))
                .quantityPrecision(entry.path("baseAssetPrecision").asInt(8))
                .minNotional(BigDecimal.ZERO);

        for (JsonNode filter : entry.path("filters")) {
            switch (filter.path("filterType").asText()) {
                case "PRICE_FILTER" -> market.pricePrecision(precisionOf(filter.path("tickSize").asText()));
                case "LOT_SIZE" -> market.quantityPrecision(precisionOf(filter.path("stepSize").asText()));
                case "NOTIONAL", "MIN_NOTIONAL" -> market.minNotional(new BigDecimal(filter.path("minNotional").asText("0")));
                default -> {}
            }
        }

        SpotMarket result = market.build();
        marketCache.put(symbol, result);
        return result;
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public BigDecimal fetchTicker(String symbol) {
        JsonNode ticker = apiClient.publicGet(
                BinanceApi.SPOT, "/api/v3/ticker/price", Map.of("symbol", symbol.toUpperCase(Locale.ROOT)));
        if (ticker == null || !ticker.hasNonNull("price")) {
            throw new ExchangeException(SupportedExchange.BINANCE, null, "No price returned for " + symbol);
        }
        return new BigDecimal(ticker.get("price").asText());
    }

    @Override
    @RateLimiter(name = "binanceApi")
    @CircuitBreaker(name = "binanceApi")
    public List<Candle> fetchKlines(String symbol, String interval, int limit) {
        JsonNode rows = apiClient.publicGet(
                BinanceApi.SPOT,
                "/api/v3/klines",
                Map.of(
                        "symbol", symbol.toUpperCase(Locale.ROOT),
                        "interval", interval,
                        "limit", String.valueOf(limit)));
        List<Candle> candles = new ArrayList<>();
        if (rows == null) {
            return candles;
        }
        for (JsonNode row : rows) {
            candles.add(Candle.builder()
                    .open(new BigDecimal(row.get(1).asText()))
                    .high(new BigDecimal(row.get(2).asText()))
                    .low(new BigDecimal(row.get(3).asText()))
                    .close(new BigDecimal(row.get(4).asText()))
                    .volume(new BigDecimal(row.get(5).asText()))
                    .closeTime(Instant.ofEpochMilli(row.get(6).asLong()))
                    .build());
        }
        return candles;
    }

    /** Decimal places implied by a step such as "0.00100000" (3). */
    static int precisionOf(String step) {
        if (step == null || step.isBlank()) {
            return 8;
        }
        return Math.max(0, new BigDecimal(step).stripTrailingZeros().scale());
    }
}
