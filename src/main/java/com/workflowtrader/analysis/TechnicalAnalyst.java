package com.workflowtrader.analysis;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.workflowtrader.config.PipelineConfig;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.exchange.ExchangeGatewayRegistry;
import com.workflowtrader.exchange.model.Candle;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * Trend and momentum read of a token from recent candles: EMA(20) vs EMA(50), RSI(14) and
 * 24-candle return, folded into a 0-10 score.
 *
 * <p>Reports are cached per (exchange, symbol) for a few minutes in Caffeine. The cache is
 * advisory; a miss simply recomputes.
 */
@Component
public class TechnicalAnalyst implements Analyst {

    private static final Logger log = LoggerFactory.getLogger(TechnicalAnalyst.class);

    static final String NAME = "technical";
    static final int MIN_CANDLES = 50;

    private final ExchangeGatewayRegistry gatewayRegistry;
    private final PipelineConfig pipelineConfig;

    /** Caffeine cache: key = "EXCHANGE|SYMBOL", value = report. */
    private final Cache<String, AnalystReport> reportCache;

    public TechnicalAnalyst(ExchangeGatewayRegistry gatewayRegistry, PipelineConfig pipelineConfig) {
        this.gatewayRegistry = gatewayRegistry;
        this.pipelineConfig = pipelineConfig;
        this.reportCache = Caffeine.newBuilder()
                .expireAfterWrite(pipelineConfig.getAnalysis().getCacheTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(500)
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AnalystReport analyze(Workflow workflow, String token) {
        String symbol = token.toUpperCase(Locale.ROOT) + workflow.getCashToken().toUpperCase(Locale.ROOT);
        String cacheKey = workflow.getExchange() + "|" + symbol;
        AnalystReport cached = reportCache.getIfPresent(cacheKey);
        if (cached != null) {
            log.debug("Technical report cache hit: symbol={}", symbol);
            return cached;
        }

        PipelineConfig.Analysis settings = pipelineConfig.getAnalysis();
        List<Candle> candles = gatewayRegistry
                .forExchange(workflow.getExchange())
                .metadata()
                .fetchKlines(symbol, settings.getKlineInterval(), settings.getKlineLimit());
        AnalystReport report = evaluate(token, candles);
        reportCache.put(cacheKey, report);
        return report;
    }

    static AnalystReport evaluate(String token, List<Candle> candles) {
        if (candles.size() < MIN_CANDLES) {
            throw new IllegalStateException("not enough candles for " + token + ": " + candles.size());
        }
        BarSeries series = toSeries(token, candles);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        int last = series.getEndIndex();

        double emaFast = new EMAIndicator(close, 20).getValue(last).doubleValue();
        double emaSlow = new EMAIndicator(close, 50).getValue(last).doubleValue();
        double rsi = new RSIIndicator(close, 14).getValue(last).doubleValue();
        double lastClose = close.getValue(last).doubleValue();
        int lookback = Math.min(24, last);
        double previousClose = close.getValue(last - lookback).doubleValue();
        double returnPct = previousClose > 0 ? (lastClose - previousClose) / previousClose * 100 : 0;
        double trendPct = emaSlow > 0 ? (emaFast - emaSlow) / emaSlow * 100 : 0;

        double score = 5.0;
        score += Math.max(-2.5, Math.min(2.5, trendPct));
        score += Math.max(-1.5, Math.min(1.5, returnPct / 4));
        if (rsi > 70) {
            score -= 1;
        } else if (rsi < 30) {
            score += 1;
        }
        score = Math.max(0, Math.min(10, score));

        return AnalystReport.builder()
                .analyst(NAME)
                .token(token)
                .available(true)
                .score(decimal(score, 1))
                .comment(comment(trendPct, rsi))
                .metrics(Map.of(
                        "emaFast", decimal(emaFast, 8),
                        "emaSlow", decimal(emaSlow, 8),
                        "rsi14", decimal(rsi, 2),
                        "returnPct", decimal(returnPct, 2)))
                .build();
    }

    private static BarSeries toSeries(String token, List<Candle> candles) {
        BarSeries series = new BaseBarSeriesBuilder().withName(token).build();
        for (Candle candle : candles) {
            series.addBar(
                    Duration.ofHours(1),
                    candle.getCloseTime().atZone(ZoneOffset.UTC),
                    candle.getOpen(),
                    candle.getHigh(),
                    candle.getLow(),
                    candle.getClose(),
                    candle.getVolume());
        }
        return series;
    }

    private static String comment(double trendPct, double rsi) {
        String trend = trendPct > 0.5 ? "uptrend" : trendPct < -0.5 ? "downtrend" : "sideways";
        String momentum = rsi > 70 ? "overbought" : rsi < 30 ? "oversold" : "neutral momentum";
        return trend + ", " + momentum;
    }

    private static BigDecimal decimal(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }
}
