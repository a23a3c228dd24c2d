package com.workflowtrader.unit.review;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.workflowtrader.agent.AgentResponse;
import com.workflowtrader.agent.DecisionAgent;
import com.workflowtrader.agent.SpotDecision;
import com.workflowtrader.agent.SpotOrderInstruction;
import com.workflowtrader.analysis.AnalystCoordinator;
import com.workflowtrader.domain.enums.OrderSide;
import com.workflowtrader.domain.enums.ReviewInterval;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.domain.enums.TradeMode;
import com.workflowtrader.domain.enums.WorkflowStatus;
import com.workflowtrader.domain.model.ReviewRawLog;
import com.workflowtrader.domain.model.ReviewResult;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.domain.model.WorkflowToken;
import com.workflowtrader.event.ReviewCompletedEvent;
import com.workflowtrader.exception.CredentialException;
import com.workflowtrader.observability.PipelineMetrics;
import com.workflowtrader.oms.FuturesExecutionEngine;
import com.workflowtrader.oms.OpenOrderCleaner;
import com.workflowtrader.oms.RebalanceOrderBuilder;
import com.workflowtrader.oms.RebalanceResult;
import com.workflowtrader.review.DecisionValidator;
import com.workflowtrader.review.ReviewPipeline;
import com.workflowtrader.review.ReviewRunResult;
import com.workflowtrader.snapshot.AgentCredentials;
import com.workflowtrader.snapshot.CredentialResolver;
import com.workflowtrader.snapshot.PortfolioSnapshot;
import com.workflowtrader.snapshot.SnapshotCollector;
import com.workflowtrader.workflow.ReviewResultService;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
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
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for ReviewPipeline covering the happy path, early failures, rejected decisions,
 * manual-rebalance workflows and failures after the result was stored.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReviewPipelineTest {

    @Mock
    private OpenOrderCleaner openOrderCleaner;

    @Mock
    private CredentialResolver credentialResolver;

    @Mock
    private SnapshotCollector snapshotCollector;

    @Mock
    private AnalystCoordinator analystCoordinator;

    @Mock
    private DecisionAgent decisionAgent;

    @Mock
    private ReviewResultService reviewResultService;

    @Mock
    private RebalanceOrderBuilder rebalanceOrderBuilder;

    @Mock
    private FuturesExecutionEngine futuresExecutionEngine;

    @Mock
    private PipelineMetrics pipelineMetrics;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ReviewPipeline pipeline;
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        pipeline = new ReviewPipeline(
                openOrderCleaner,
                credentialResolver,
                snapshotCollector,
                analystCoordinator,
                decisionAgent,
                new DecisionValidator(),
                reviewResultService,
                rebalanceOrderBuilder,
                futuresExecutionEngine,
                pipelineMetrics,
                eventPublisher);

        workflow = Workflow.builder()
                .id(5L)
                .userId("user-1")
                .mode(TradeMode.SPOT)
                .exchange(SupportedExchange.BINANCE)
                .status(WorkflowStatus.ACTIVE)
                .cashToken("USDT")
                .tokens(List.of(new WorkflowToken("BTC", null), new WorkflowToken("ETH", null)))
                .reviewInterval(ReviewInterval.H1)
                .model("gpt-4.1")
                .aiApiKeyId(1L)
                .exchangeApiKeyId(2L)
                .build();

        when(openOrderCleaner.cancelOpenOrders(anyLong(), anyString()))
                .thenReturn(new OpenOrderCleaner.CleanupSummary(0, 0, 0));
        when(credentialResolver.resolve(workflow)).thenReturn(new AgentCredentials("gpt-4.1", "openai", "sk-test"));
        when(snapshotCollector.collect(workflow))
                .thenReturn(PortfolioSnapshot.builder().workflowId(5L).cashToken("USDT").build());
        when(analystCoordinator.analyze(workflow)).thenReturn(Map.of());
        when(reviewResultService.saveRawLog(anyLong(), any(), any()))
                .thenReturn(ReviewRawLog.builder().id(50L).build());
        when(reviewResultService.saveResult(any())).thenAnswer(inv -> {
            ReviewResult result = inv.getArgument(0);
            result.setId(100L);
            return result;
        });
        when(rebalanceOrderBuilder.execute(any(), anyLong(), any())).thenReturn(new RebalanceResult());
    }

    private void agentAnswers(SpotDecision decision, String rejection) {
        doReturn(new AgentResponse<>("{\"prompt\":true}", "{\"raw\":true}", decision, rejection))
                .when(decisionAgent)
                .decide(any());
    }

    private static SpotDecision buyBtc() {
        return SpotDecision.builder()
                .orders(List.of(SpotOrderInstruction.builder()
                        .pair("BTC/USDT")
                        .token("USDT")
                        .side(OrderSide.BUY)
                        .quantity(new BigDecimal("100"))
                        .build()))
                .shortReport("Adding BTC")
                .build();
    }

    private ReviewResult storedResult() {
        ArgumentCaptor<ReviewResult> captor = ArgumentCaptor.forClass(ReviewResult.class);
        verify(reviewResultService).saveResult(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Successful runs")
    class Success {

        @Test
        @DisplayName("Valid decision is stored once and executed against the stored result")
        void executesDecision() {
            agentAnswers(buyBtc(), null);

            ReviewRunResult result = pipeline.run(workflow);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isRebalance()).isTrue();
            assertThat(result.isExecuted()).isTrue();
            assertThat(result.getReviewResultId()).isEqualTo(100L);

            ReviewResult stored = storedResult();
            assertThat(stored.isRebalance()).isTrue();
            assertThat(stored.getShortReport()).isEqualTo("Adding BTC");
            assertThat(stored.getRawLogId()).isEqualTo(50L);
            verify(reviewResultService).saveRawLog(5L, "{\"prompt\":true}", "{\"raw\":true}");
            verify(rebalanceOrderBuilder).execute(eq(workflow), eq(100L), any());
            verify(openOrderCleaner).cancelOpenOrders(5L, "Could not fill within interval");
        }

        @Test
        @DisplayName("Manual-rebalance workflow stores the decision without executing it")
        void manualRebalanceSkipsExecution() {
            workflow.setManualRebalance(true);
            agentAnswers(buyBtc(), null);

            ReviewRunResult result = pipeline.run(workflow);

            assertThat(result.isRebalance()).isTrue();
            assertThat(result.isExecuted()).isFalse();
            verifyNoInteractions(rebalanceOrderBuilder, futuresExecutionEngine);
        }

        @Test
        @DisplayName("Empty decision is stored without rebalance")
        void emptyDecision() {
            agentAnswers(SpotDecision.builder().orders(List.of()).shortReport("Hold").build(), null);

            ReviewRunResult result = pipeline.run(workflow);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isRebalance()).isFalse();
            assertThat(storedResult().isRebalance()).isFalse();
            verifyNoInteractions(rebalanceOrderBuilder);
        }

        @Test
        @DisplayName("Cleanup and analyst failures do not stop the run")
        void softStepFailures() {
            when(openOrderCleaner.cancelOpenOrders(anyLong(), anyString()))
                    .thenThrow(new IllegalStateException("exchange down"));
            when(analystCoordinator.analyze(workflow)).thenThrow(new IllegalStateException("no candles"));
            agentAnswers(buyBtc(), null);

            ReviewRunResult result = pipeline.run(workflow);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isExecuted()).isTrue();
        }
    }

    @Nested
    @DisplayName("Failed runs")
    class Failures {

        @Test
        @DisplayName("Missing credentials store exactly one failure result and reach no agent or exchange")
        void credentialFailure() {
            when(credentialResolver.resolve(workflow))
                    .thenThrow(new CredentialException("AI API key not configured", Map.of("workflowId", 5L)));

            ReviewRunResult result = pipeline.run(workflow);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo("AI API key not configured");
            assertThat(result.getReviewResultId()).isEqualTo(100L);
            ReviewResult stored = storedResult();
            assertThat(stored.getError()).isEqualTo("AI API key not configured");
            assertThat(stored.isRebalance()).isFalse();
            verifyNoInteractions(decisionAgent, rebalanceOrderBuilder);
        }

        @Test
        @DisplayName("Decision outside the workflow tokens is stored as an error and not executed")
        void invalidDecision() {
            SpotDecision decision = SpotDecision.builder()
                    .orders(List.of(SpotOrderInstruction.builder()
                            .pair("SOL/USDT")
                            .token("SOL")
                            .side(OrderSide.BUY)
                            .quantity(BigDecimal.ONE)
                            .build()))
                    .shortReport("Buy SOL")
                    .build();
            agentAnswers(decision, null);

            ReviewRunResult result = pipeline.run(workflow);

            assertThat(result.isSuccess()).isFalse();
            ReviewResult stored = storedResult();
            assertThat(stored.isRebalance()).isFalse();
            assertThat(stored.getError()).isEqualTo("order 1: pair SOLUSDT is outside the workflow tokens");
            verifyNoInteractions(rebalanceOrderBuilder);
        }

        @Test
        @DisplayName("Model error answer is stored with the rejection text")
        void rejectedByModel() {
            agentAnswers(null, "insufficient data");

            ReviewRunResult result = pipeline.run(workflow);

            assertThat(result.isSuccess()).isFalse();
            assertThat(storedResult().getError()).isEqualTo("decision unavailable: insufficient data");
        }

        @Test
        @DisplayName("Failure after the result was stored writes no second result")
        void failureAfterPersist() {
            agentAnswers(buyBtc(), null);
            when(rebalanceOrderBuilder.execute(any(), anyLong(), any()))
                    .thenThrow(new IllegalStateException("No exchange gateway registered for BINANCE"));

            ReviewRunResult result = pipeline.run(workflow);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getReviewResultId()).isEqualTo(100L);
            verify(reviewResultService, times(1)).saveResult(any());
            verify(reviewResultService, times(1)).saveRawLog(anyLong(), any(), any());
        }
    }

    @Test
    @DisplayName("Every run publishes a completion event")
    void publishesCompletion() {
        agentAnswers(buyBtc(), null);

        pipeline.run(workflow);

        ArgumentCaptor<ReviewCompletedEvent> captor = ArgumentCaptor.forClass(ReviewCompletedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getWorkflowId()).isEqualTo(5L);
        assertThat(captor.getValue().isSuccess()).isTrue();
        verify(pipelineMetrics, never()).recordStep(eq("executeDecision"), anyLong(), eq(false));
        verify(pipelineMetrics).recordStep(eq("persistResult"), anyLong(), anyBoolean());
    }
}
