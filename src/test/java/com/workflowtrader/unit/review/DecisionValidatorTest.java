package com.workflowtrader.unit.review;

import static org.assertj.core.api.Assertions.assertThat;

import com.workflowtrader.agent.FuturesActionInstruction;
import com.workflowtrader.agent.FuturesDecision;
import com.workflowtrader.agent.SpotDecision;
import com.workflowtrader.agent.SpotOrderInstruction;
import com.workflowtrader.domain.enums.FuturesActionType;
import com.workflowtrader.domain.enums.OrderSide;
import com.workflowtrader.domain.enums.PositionSide;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.domain.model.WorkflowToken;
import com.workflowtrader.review.DecisionValidator;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DecisionValidatorTest {

    private final DecisionValidator validator = new DecisionValidator();

    private final Workflow workflow = Workflow.builder()
            .id(1L)
            .cashToken("USDT")
            .tokens(List.of(new WorkflowToken("BTC", null), new WorkflowToken("ETH", null)))
            .build();

    private static SpotDecision spot(SpotOrderInstruction... orders) {
        return SpotDecision.builder().orders(List.of(orders)).shortReport("r").build();
    }

    private static SpotOrderInstruction order(String pair, String token, String quantity) {
        return SpotOrderInstruction.builder()
                .pair(pair)
                .token(token)
                .side(OrderSide.BUY)
                .quantity(quantity != null ? new BigDecimal(quantity) : null)
                .build();
    }

    @Nested
    @DisplayName("Spot")
    class Spot {

        @Test
        void acceptsPairsWithinTheWorkflow() {
            assertThat(validator.validateSpot(workflow, spot(order("BTC/USDT", "USDT", "10"), order("ETHBTC", "ETH", "1"))))
                    .isNull();
        }

        @Test
        void rejectsUnknownPair() {
            assertThat(validator.validateSpot(workflow, spot(order("FOO/USDT", "FOO", "1"))))
                    .isEqualTo("order 1: unknown pair FOO/USDT");
        }

        @Test
        void rejectsPairOutsideWorkflow() {
            assertThat(validator.validateSpot(workflow, spot(order("BTC/USDT", "BTC", "1"), order("SOLUSDT", "SOL", "1"))))
                    .isEqualTo("order 2: pair SOLUSDT is outside the workflow tokens");
        }

        @Test
        void rejectsTokenNotInPair() {
            assertThat(validator.validateSpot(workflow, spot(order("BTC/USDT", "ETH", "1"))))
                    .isEqualTo("order 1: token ETH is not a leg of BTCUSDT");
        }

        @Test
        void rejectsNonPositiveQuantity() {
            assertThat(validator.validateSpot(workflow, spot(order("BTC/USDT", "BTC", "0"))))
                    .isEqualTo("order 1: quantity must be positive");
        }
    }

    @Nested
    @DisplayName("Futures")
    class Futures {

        private FuturesDecision futures(FuturesActionInstruction... actions) {
            return FuturesDecision.builder().actions(List.of(actions)).shortReport("r").build();
        }

        private FuturesActionInstruction action(String symbol, FuturesActionType type, String quantity) {
            return FuturesActionInstruction.builder()
                    .symbol(symbol)
                    .positionSide(PositionSide.LONG)
                    .action(type)
                    .quantity(quantity != null ? new BigDecimal(quantity) : null)
                    .build();
        }

        @Test
        void acceptsWorkflowSymbolsAndHoldWithoutQuantity() {
            assertThat(validator.validateFutures(
                            workflow,
                            futures(action("btcusdt", FuturesActionType.OPEN, "0.1"), action("ETHUSDT", FuturesActionType.HOLD, null))))
                    .isNull();
        }

        @Test
        void rejectsForeignSymbol() {
            assertThat(validator.validateFutures(workflow, futures(action("SOLUSDT", FuturesActionType.OPEN, "1"))))
                    .isEqualTo("action 1: symbol SOLUSDT is outside the workflow tokens");
        }

        @Test
        void rejectsCashSymbol() {
            assertThat(validator.validateFutures(workflow, futures(action("USDT", FuturesActionType.OPEN, "1"))))
                    .isEqualTo("action 1: symbol USDT is outside the workflow tokens");
        }

        @Test
        void rejectsMissingQuantity() {
            assertThat(validator.validateFutures(workflow, futures(action("BTCUSDT", FuturesActionType.CLOSE, null))))
                    .isEqualTo("action 1: quantity must be positive");
        }
    }
}
