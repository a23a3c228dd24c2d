package com.workflowtrader.unit.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.when;

import com.workflowtrader.config.PipelineConfig;
import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.enums.OrderSide;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.domain.enums.TradeMode;
import com.workflowtrader.domain.model.LimitOrder;
import com.workflowtrader.domain.model.LimitOrderIntent;
import com.workflowtrader.domain.model.ReviewResult;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.domain.model.WorkflowToken;
import com.workflowtrader.exception.ValidationException;
import com.workflowtrader.exchange.ExchangeGateway;
import com.workflowtrader.exchange.ExchangeGatewayRegistry;
import com.workflowtrader.exchange.FuturesTradingModule;
import com.workflowtrader.exchange.MarketMetadataModule;
import com.workflowtrader.exchange.SpotTradingModule;
import com.workflowtrader.exchange.model.FuturesWallet;
import com.workflowtrader.exchange.model.SpotBalance;
import com.workflowtrader.oms.OrderLedgerService;
import com.workflowtrader.snapshot.PortfolioSnapshot;
import com.workflowtrader.snapshot.SnapshotCollector;
import com.workflowtrader.workflow.ReviewResultService;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
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
class SnapshotCollectorTest {

    @Mock
    private ExchangeGatewayRegistry gatewayRegistry;

    @Mock
    private ExchangeGateway gateway;

    @Mock
    private MarketMetadataModule metadata;

    @Mock
    private SpotTradingModule spot;

    @Mock
    private FuturesTradingModule futures;

    @Mock
    private ReviewResultService reviewResultService;

    @Mock
    private OrderLedgerService orderLedgerService;

    private SnapshotCollector collector;
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        collector = new SnapshotCollector(gatewayRegistry, reviewResultService, orderLedgerService, new PipelineConfig());
        workflow = Workflow.builder()
                .id(4L)
                .userId("user-1")
                .mode(TradeMode.SPOT)
                .exchange(SupportedExchange.BINANCE)
                .cashToken("usdt")
                .tokens(List.of(new WorkflowToken("BTC", new BigDecimal("0.1")), new WorkflowToken("ETH", null)))
                .build();
        when(gatewayRegistry.forExchange(any())).thenReturn(gateway);
        when(gateway.metadata()).thenReturn(metadata);
        when(gateway.spot()).thenReturn(Optional.of(spot));
        when(gateway.futures()).thenReturn(Optional.of(futures));
        when(reviewResultService.findRecent(anyLong(), anyInt())).thenReturn(List.of());
    }

    @Test
    @DisplayName("Spot snapshot values every token and the cash token in cash")
    void spotSnapshot() {
        when(spot.fetchBalances("user-1"))
                .thenReturn(List.of(
                        SpotBalance.builder().asset("BTC").free(new BigDecimal("0.5")).locked(new BigDecimal("0.1")).build(),
                        SpotBalance.builder().asset("USDT").free(new BigDecimal("1000")).locked(BigDecimal.ZERO).build()));
        when(metadata.fetchTicker("BTCUSDT")).thenReturn(new BigDecimal("50000"));
        when(metadata.fetchTicker("ETHUSDT")).thenReturn(new BigDecimal("3000"));

        PortfolioSnapshot snapshot = collector.collect(workflow);

        assertThat(snapshot.getCashToken()).isEqualTo("USDT");
        assertThat(snapshot.getPositions()).extracting(PortfolioSnapshot.Position::getToken)
                .containsExactly("BTC", "ETH", "USDT");
        PortfolioSnapshot.Position btc = snapshot.getPositions().get(0);
        assertThat(btc.getQuantity()).isEqualByComparingTo("0.6");
        assertThat(btc.getValue()).isEqualByComparingTo("30000");
        assertThat(btc.getMinAllocation()).isEqualByComparingTo("0.1");
        assertThat(snapshot.getPositions().get(1).getQuantity()).isEqualByComparingTo("0");
        assertThat(snapshot.getTotalValue()).isEqualByComparingTo("31000");
        assertThat(snapshot.getRoutes()).containsExactly("BTCUSDT", "ETHUSDT");
    }

    @Test
    @DisplayName("Spot workflow on an exchange without spot trading cannot be snapshotted")
    void spotUnsupported() {
        when(gateway.spot()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> collector.collect(workflow)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Futures snapshot carries the wallet and a price per perpetual")
    void futuresSnapshot() {
        workflow.setMode(TradeMode.FUTURES);
        when(futures.fetchWallet("user-1"))
                .thenReturn(FuturesWallet.builder().totalWalletBalance(new BigDecimal("2500")).build());
        when(metadata.fetchTicker("BTCUSDT")).thenReturn(new BigDecimal("50000"));
        when(metadata.fetchTicker("ETHUSDT")).thenReturn(new BigDecimal("3000"));

        PortfolioSnapshot snapshot = collector.collect(workflow);

        assertThat(snapshot.getTotalValue()).isEqualByComparingTo("2500");
        assertThat(snapshot.getMarkPrices()).containsOnlyKeys("BTCUSDT", "ETHUSDT");
        assertThat(snapshot.getPositions()).isEmpty();
    }

    @Test
    @DisplayName("History lists recent results with the orders each produced")
    void history() {
        when(spot.fetchBalances("user-1")).thenReturn(List.of());
        when(metadata.fetchTicker(any())).thenReturn(BigDecimal.ONE);
        when(reviewResultService.findRecent(4L, 5))
                .thenReturn(List.of(
                        ReviewResult.builder().id(30L).rebalance(true).shortReport("Bought BTC").build(),
                        ReviewResult.builder().id(29L).error("AI API key not configured").build()));
        when(orderLedgerService.findLimitOrdersForResults(List.of(30L, 29L)))
                .thenReturn(List.of(LimitOrder.builder()
                        .reviewResultId(30L)
                        .symbol("BTCUSDT")
                        .status(LimitOrderStatus.CANCELED)
                        .cancellationReason("Could not fill within interval")
                        .planned(LimitOrderIntent.builder()
                                .pair("BTC/USDT")
                                .side(OrderSide.BUY)
                                .quantity(new BigDecimal("0.01"))
                                .price(new BigDecimal("49950"))
                                .build())
                        .build()));

        PortfolioSnapshot snapshot = collector.collect(workflow);

        assertThat(snapshot.getHistory()).hasSize(2);
        PortfolioSnapshot.HistoryEntry latest = snapshot.getHistory().get(0);
        assertThat(latest.getShortReport()).isEqualTo("Bought BTC");
        assertThat(latest.getOrders()).hasSize(1);
        assertThat(latest.getOrders().get(0).getSide()).isEqualTo("BUY");
        assertThat(latest.getOrders().get(0).getReason()).isEqualTo("Could not fill within interval");
        assertThat(snapshot.getHistory().get(1).getError()).isEqualTo("AI API key not configured");
        assertThat(snapshot.getHistory().get(1).getOrders()).isEmpty();
    }
}
