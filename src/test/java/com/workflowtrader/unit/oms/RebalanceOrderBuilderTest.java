package com.workflowtrader.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.workflowtrader.agent.SpotOrderInstruction;
import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.enums.OrderSide;
import com.workflowtrader.domain.enums.ReviewInterval;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.domain.enums.TradeMode;
import com.workflowtrader.domain.enums.WorkflowStatus;
import com.workflowtrader.domain.model.LimitOrder;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.domain.model.WorkflowToken;
import com.workflowtrader.exception.ExchangeException;
import com.workflowtrader.exchange.ExchangeGateway;
import com.workflowtrader.exchange.ExchangeGatewayRegistry;
import com.workflowtrader.exchange.MarketMetadataModule;
import com.workflowtrader.exchange.SpotTradingModule;
import com.workflowtrader.exchange.model.ExchangeOrderState;
import com.workflowtrader.exchange.model.SpotMarket;
import com.workflowtrader.exchange.model.SpotOrderRequest;
import com.workflowtrader.oms.OrderLedgerService;
import com.workflowtrader.oms.RebalanceOrderBuilder;
import com.workflowtrader.oms.RebalanceResult;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RebalanceOrderBuilderTest {

    @Mock
    private ExchangeGatewayRegistry gatewayRegistry;

    @Mock
    private ExchangeGateway gateway;

    @Mock
    private MarketMetadataModule metadata;

    @Mock
    private SpotTradingModule spot;

    @Mock
    private OrderLedgerService orderLedgerService;

    private RebalanceOrderBuilder builder;
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        builder = new RebalanceOrderBuilder(gatewayRegistry, orderLedgerService);
        workflow = Workflow.builder()
                .id(7L)
                .userId("user-1")
                .mode(TradeMode.SPOT)
                .exchange(SupportedExchange.BINANCE)
                .status(WorkflowStatus.ACTIVE)
                .cashToken("USDT")
                .tokens(List.of(new WorkflowToken("BTC", null)))
                .reviewInterval(ReviewInterval.H1)
                .build();

        when(gatewayRegistry.forExchange(SupportedExchange.BINANCE)).thenReturn(gateway);
        when(gateway.metadata()).thenReturn(metadata);
        when(gateway.spot()).thenReturn(Optional.of(spot));
        when(metadata.fetchMarket("BTC", "USDT"))
                .thenReturn(SpotMarket.builder()
                        .symbol("BTCUSDT")
                        .baseAsset("BTC")
                        .quoteAsset("USDT")
                        .pricePrecision(2)
                        .quantityPrecision(4)
                        .minNotional(new BigDecimal("5"))
                        .build());
        when(metadata.fetchTicker("BTCUSDT")).thenReturn(new BigDecimal("100"));
        when(orderLedgerService.recordLimitOrder(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    private SpotOrderInstruction buy(String quantity) {
        return SpotOrderInstruction.builder()
                .pair("BTC/USDT")
                .token("BTC")
                .side(OrderSide.BUY)
                .quantity(new BigDecimal(quantity))
                .build();
    }

    private LimitOrder recordedOrder() {
        ArgumentCaptor<LimitOrder> captor = ArgumentCaptor.forClass(LimitOrder.class);
        verify(orderLedgerService).recordLimitOrder(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Placement")
    class Placement {

        @Test
        @DisplayName("BUY without a limit price is placed 0.1% below market")
        void buyAtSpreadBelowMarket() {
            when(spot.placeLimitOrder(anyString(), any()))
                    .thenReturn(ExchangeOrderState.builder().orderId("123").status("NEW").build());

            RebalanceResult result = builder.execute(workflow, 11L, List.of(buy("1")));

            ArgumentCaptor<SpotOrderRequest> request = ArgumentCaptor.forClass(SpotOrderRequest.class);
            verify(spot).placeLimitOrder(eq("user-1"), request.capture());
            assertThat(request.getValue().getPrice()).isEqualByComparingTo("99.9");
            assertThat(request.getValue().getQuantity()).isEqualByComparingTo("1");
            assertThat(result.getPlaced()).isEqualTo(1);

            LimitOrder order = recordedOrder();
            assertThat(order.getStatus()).isEqualTo(LimitOrderStatus.OPEN);
            assertThat(order.getOrderId()).isEqualTo("123");
            assertThat(order.getReviewResultId()).isEqualTo(11L);
            assertThat(order.getPlanned().getPrice()).isEqualByComparingTo("99.9");
            assertThat(order.getPlanned().getMarketPrice()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("SELL keeps a requested limit above the spread-adjusted market price")
        void sellKeepsHigherLimit() {
            when(spot.placeLimitOrder(anyString(), any()))
                    .thenReturn(ExchangeOrderState.builder().orderId("9").status("NEW").build());
            SpotOrderInstruction sell = SpotOrderInstruction.builder()
                    .pair("BTCUSDT")
                    .token("BTC")
                    .side(OrderSide.SELL)
                    .quantity(new BigDecimal("0.5"))
                    .limitPrice(new BigDecimal("105"))
                    .build();

            builder.execute(workflow, 11L, List.of(sell));

            ArgumentCaptor<SpotOrderRequest> request = ArgumentCaptor.forClass(SpotOrderRequest.class);
            verify(spot).placeLimitOrder(anyString(), request.capture());
            assertThat(request.getValue().getPrice()).isEqualByComparingTo("105");
        }

        @Test
        @DisplayName("Quantity is truncated, never rounded, to the symbol precision")
        void quantityTruncated() {
            when(spot.placeLimitOrder(anyString(), any()))
                    .thenReturn(ExchangeOrderState.builder().orderId("1").status("NEW").build());

            builder.execute(workflow, 11L, List.of(buy("0.123456789")));

            ArgumentCaptor<SpotOrderRequest> request = ArgumentCaptor.forClass(SpotOrderRequest.class);
            verify(spot).placeLimitOrder(anyString(), request.capture());
            assertThat(request.getValue().getQuantity()).isEqualByComparingTo("0.1234");
        }

        @Test
        @DisplayName("Quote-denominated quantity is converted to base at the order price")
        void quoteQuantityConverted() {
            when(spot.placeLimitOrder(anyString(), any()))
                    .thenReturn(ExchangeOrderState.builder().orderId("1").status("NEW").build());
            SpotOrderInstruction instruction = SpotOrderInstruction.builder()
                    .pair("BTC/USDT")
                    .token("USDT")
                    .side(OrderSide.BUY)
                    .quantity(new BigDecimal("50"))
                    .build();

            builder.execute(workflow, 11L, List.of(instruction));

            ArgumentCaptor<SpotOrderRequest> request = ArgumentCaptor.forClass(SpotOrderRequest.class);
            verify(spot).placeLimitOrder(anyString(), request.capture());
            // 50 / 99.9 = 0.50050..., truncated to 4 decimals
            assertThat(request.getValue().getQuantity()).isEqualByComparingTo("0.5005");
        }

        @Test
        @DisplayName("One failing instruction does not stop the next one")
        void failuresAreIndependent() {
            when(spot.placeLimitOrder(anyString(), any()))
                    .thenThrow(new ExchangeException(SupportedExchange.BINANCE, -2010, "Account has insufficient balance"))
                    .thenReturn(ExchangeOrderState.builder().orderId("2").status("NEW").build());

            RebalanceResult result = builder.execute(workflow, 11L, List.of(buy("1"), buy("0.5")));

            assertThat(result.getPlaced()).isEqualTo(1);
            assertThat(result.getCanceled()).isEqualTo(1);
            ArgumentCaptor<LimitOrder> captor = ArgumentCaptor.forClass(LimitOrder.class);
            verify(orderLedgerService, times(2)).recordLimitOrder(captor.capture());
            assertThat(captor.getAllValues().get(0).getStatus()).isEqualTo(LimitOrderStatus.CANCELED);
            assertThat(captor.getAllValues().get(0).getCancellationReason())
                    .isEqualTo("Account has insufficient balance");
            assertThat(captor.getAllValues().get(1).getStatus()).isEqualTo(LimitOrderStatus.OPEN);
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Below min notional after truncation is rejected without an exchange call")
        void minNotional() {
            RebalanceResult result = builder.execute(workflow, 11L, List.of(buy("0.01")));

            verify(spot, never()).placeLimitOrder(anyString(), any());
            assertThat(result.getCanceled()).isEqualTo(1);
            LimitOrder order = recordedOrder();
            assertThat(order.getStatus()).isEqualTo(LimitOrderStatus.CANCELED);
            assertThat(order.getCancellationReason()).isEqualTo("order below min notional");
            assertThat(order.getOrderId()).startsWith("rejected-");
        }

        @Test
        @DisplayName("Price divergence above the allowed ratio is rejected and flagged for retry")
        void priceDivergence() {
            SpotOrderInstruction instruction = SpotOrderInstruction.builder()
                    .pair("BTC/USDT")
                    .token("BTC")
                    .side(OrderSide.BUY)
                    .quantity(BigDecimal.ONE)
                    .basePrice(new BigDecimal("90"))
                    .maxPriceDivergencePct(new BigDecimal("0.05"))
                    .build();

            RebalanceResult result = builder.execute(workflow, 11L, List.of(instruction));

            verify(spot, never()).placeLimitOrder(anyString(), any());
            assertThat(result.getPriceDivergenceCancellations()).isEqualTo(1);
            assertThat(result.needsPriceDivergenceRetry()).isTrue();
            assertThat(recordedOrder().getCancellationReason()).isEqualTo("price divergence too high");
        }

        @Test
        @DisplayName("Divergence within the allowed ratio is placed")
        void divergenceWithinLimit() {
            when(spot.placeLimitOrder(anyString(), any()))
                    .thenReturn(ExchangeOrderState.builder().orderId("5").status("NEW").build());
            SpotOrderInstruction instruction = SpotOrderInstruction.builder()
                    .pair("BTC/USDT")
                    .token("BTC")
                    .side(OrderSide.BUY)
                    .quantity(BigDecimal.ONE)
                    .basePrice(new BigDecimal("98"))
                    .maxPriceDivergencePct(new BigDecimal("0.05"))
                    .build();

            RebalanceResult result = builder.execute(workflow, 11L, List.of(instruction));

            assertThat(result.getPlaced()).isEqualTo(1);
            assertThat(result.needsPriceDivergenceRetry()).isFalse();
        }

        @Test
        @DisplayName("A token that is not a leg of the pair is rejected as an invalid pair")
        void tokenNotInPair() {
            SpotOrderInstruction instruction = SpotOrderInstruction.builder()
                    .pair("BTC/USDT")
                    .token("ETH")
                    .side(OrderSide.BUY)
                    .quantity(BigDecimal.ONE)
                    .build();

            builder.execute(workflow, 11L, List.of(instruction));

            verify(metadata, never()).fetchMarket(anyString(), anyString());
            assertThat(recordedOrder().getCancellationReason()).isEqualTo("invalid pair/token");
        }

        @Test
        @DisplayName("Missing order id in the exchange response is recorded as canceled")
        void orderIdMissing() {
            when(spot.placeLimitOrder(anyString(), any()))
                    .thenReturn(ExchangeOrderState.builder().status("NEW").build());

            RebalanceResult result = builder.execute(workflow, 11L, List.of(buy("1")));

            assertThat(result.getCanceled()).isEqualTo(1);
            assertThat(recordedOrder().getCancellationReason()).isEqualTo("order id missing");
        }

        @Test
        @DisplayName("Exchange without spot trading records every instruction as canceled")
        void spotUnsupported() {
            when(gateway.spot()).thenReturn(Optional.empty());

            RebalanceResult result = builder.execute(workflow, 11L, List.of(buy("1"), buy("2")));

            assertThat(result.getCanceled()).isEqualTo(2);
            assertThat(result.getPlaced()).isZero();
            ArgumentCaptor<LimitOrder> captor = ArgumentCaptor.forClass(LimitOrder.class);
            verify(orderLedgerService, times(2)).recordLimitOrder(captor.capture());
            assertThat(captor.getAllValues())
                    .extracting(LimitOrder::getCancellationReason)
                    .containsOnly("spot trading not supported for exchange");
            verify(metadata, never()).fetchTicker(anyString());
        }
    }
}
