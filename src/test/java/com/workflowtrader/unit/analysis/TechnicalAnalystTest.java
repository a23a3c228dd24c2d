package com.workflowtrader.unit.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.workflowtrader.analysis.AnalystReport;
import com.workflowtrader.analysis.TechnicalAnalyst;
import com.workflowtrader.config.PipelineConfig;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.exchange.ExchangeGateway;
import com.workflowtrader.exchange.ExchangeGatewayRegistry;
import com.workflowtrader.exchange.MarketMetadataModule;
import com.workflowtrader.exchange.model.Candle;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TechnicalAnalystTest {

    @Mock
    private ExchangeGatewayRegistry gatewayRegistry;

    @Mock
    private ExchangeGateway gateway;

    @Mock
    private MarketMetadataModule metadata;

    private TechnicalAnalyst analyst;
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        analyst = new TechnicalAnalyst(gatewayRegistry, new PipelineConfig());
        workflow = Workflow.builder().id(1L).exchange(SupportedExchange.BINANCE).cashToken("USDT").build();
        when(gatewayRegistry.forExchange(SupportedExchange.BINANCE)).thenReturn(gateway);
        when(gateway.metadata()).thenReturn(metadata);
    }

    private static List<Candle> candles(int count, IntFunction<Double> closeAt) {
        Instant start = Instant.parse("2026-01-01T00:00:00Z");
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            BigDecimal close = BigDecimal.valueOf(closeAt.apply(i));
            candles.add(Candle.builder()
                    .closeTime(start.plus(i + 1L, ChronoUnit.HOURS))
                    .open(close)
                    .high(close)
                    .low(close)
                    .close(close)
                    .volume(BigDecimal.TEN)
                    .build());
        }
        return candles;
    }

    @Test
    @DisplayName("Steady rise reads as an uptrend with an above-neutral score")
    void uptrend() {
        when(metadata.fetchKlines("BTCUSDT", "1h", 200)).thenReturn(candles(120, i -> 100 + i * 0.5));

        AnalystReport report = analyst.analyze(workflow, "BTC");

        assertThat(report.isAvailable()).isTrue();
        assertThat(report.getAnalyst()).isEqualTo("technical");
        assertThat(report.getComment()).startsWith("uptrend");
        assertThat(report.getScore()).isGreaterThan(new BigDecimal("5"));
        assertThat(report.getMetrics()).containsKeys("emaFast", "emaSlow", "rsi14", "returnPct");
    }

    @Test
    @DisplayName("Steady fall reads as a downtrend with a below-neutral score")
    void downtrend() {
        when(metadata.fetchKlines("ETHUSDT", "1h", 200)).thenReturn(candles(120, i -> 200 - i * 0.5));

        AnalystReport report = analyst.analyze(workflow, "ETH");

        assertThat(report.getComment()).startsWith("downtrend");
        assertThat(report.getScore()).isLessThan(new BigDecimal("5"));
    }

    @Test
    @DisplayName("Second request for the same symbol is served from cache")
    void cached() {
        when(metadata.fetchKlines("BTCUSDT", "1h", 200)).thenReturn(candles(120, i -> 100.0));

        analyst.analyze(workflow, "BTC");
        analyst.analyze(workflow, "BTC");

        verify(metadata, times(1)).fetchKlines(anyString(), anyString(), anyInt());
    }

    @Test
    @DisplayName("Too few candles is an error for the coordinator to fall back on")
    void tooFewCandles() {
        when(metadata.fetchKlines("BTCUSDT", "1h", 200)).thenReturn(candles(10, i -> 100.0));

        assertThatThrownBy(() -> analyst.analyze(workflow, "BTC"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not enough candles");
    }
}
