package com.workflowtrader.review;

import com.workflowtrader.agent.AgentRequest;
import com.workflowtrader.agent.AgentResponse;
import com.workflowtrader.agent.DecisionAgent;
import com.workflowtrader.agent.DecisionSchemas;
import com.workflowtrader.agent.FuturesDecision;
import com.workflowtrader.agent.SpotDecision;
import com.workflowtrader.agent.TradingDecision;
import com.workflowtrader.analysis.AnalystCoordinator;
import com.workflowtrader.domain.enums.TradeMode;
import com.workflowtrader.domain.model.ReviewRawLog;
import com.workflowtrader.domain.model.ReviewResult;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.event.ReviewCompletedEvent;
import com.workflowtrader.mapper.JsonHelper;
import com.workflowtrader.observability.PipelineMetrics;
import com.workflowtrader.oms.CancelReasons;
import com.workflowtrader.oms.FuturesExecutionEngine;
import com.workflowtrader.oms.FuturesExecutionResult;
import com.workflowtrader.oms.OpenOrderCleaner;
import com.workflowtrader.oms.RebalanceOrderBuilder;
import com.workflowtrader.oms.RebalanceResult;
import com.workflowtrader.snapshot.AgentCredentials;
import com.workflowtrader.snapshot.CredentialResolver;
import com.workflowtrader.snapshot.PortfolioSnapshot;
import com.workflowtrader.snapshot.SnapshotCollector;
import com.workflowtrader.workflow.ReviewResultService;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * One review run of one workflow. Steps run strictly in order:
 * <ol>
 *   <li>cleanupOpenOrders: cancel orders left open by the previous run</li>
 *   <li>collectSnapshot: check credentials, read balances, prices and history</li>
 *   <li>runAnalysts: per-token enrichment, degrades to fallback reports</li>
 *   <li>runDecisionAgent: one model call</li>
 *   <li>validateDecision: tokens, pairs and quantities against the workflow</li>
 *   <li>persistResult: raw log, then exactly one review result</li>
 *   <li>executeDecision: place spot orders or run futures actions</li>
 * </ol>
 *
 * <p>Cleanup and analyst failures are logged and the run continues. Any other failure ends
 * the run; if no result was stored yet a failure result carrying the error message is stored
 * instead, so every run leaves exactly one review result.
 *
 * <p>The caller owns the {@link ConcurrencyGuard}; this class never touches it.
 */
@Service
public class ReviewPipeline {

    private static final Logger log = LoggerFactory.getLogger(ReviewPipeline.class);

    static final String NO_DECISION = "decision unavailable";

    private final OpenOrderCleaner openOrderCleaner;
    private final CredentialResolver credentialResolver;
    private final SnapshotCollector snapshotCollector;
    private final AnalystCoordinator analystCoordinator;
    private final DecisionAgent decisionAgent;
    private final DecisionValidator decisionValidator;
    private final ReviewResultService reviewResultService;
    private final RebalanceOrderBuilder rebalanceOrderBuilder;
    private final FuturesExecutionEngine futuresExecutionEngine;
    private final PipelineMetrics pipelineMetrics;
    private final ApplicationEventPublisher eventPublisher;

    public ReviewPipeline(
            OpenOrderCleaner openOrderCleaner,
            CredentialResolver credentialResolver,
            SnapshotCollector snapshotCollector,
            AnalystCoordinator analystCoordinator,
            DecisionAgent decisionAgent,
            DecisionValidator decisionValidator,
            ReviewResultService reviewResultService,
            RebalanceOrderBuilder rebalanceOrderBuilder,
            FuturesExecutionEngine futuresExecutionEngine,
            PipelineMetrics pipelineMetrics,
            ApplicationEventPublisher eventPublisher) {
        this.openOrderCleaner = openOrderCleaner;
        this.credentialResolver = credentialResolver;
        this.snapshotCollector = snapshotCollector;
        this.analystCoordinator = analystCoordinator;
        this.decisionAgent = decisionAgent;
        this.decisionValidator = decisionValidator;
        this.reviewResultService = reviewResultService;
        this.rebalanceOrderBuilder = rebalanceOrderBuilder;
        this.futuresExecutionEngine = futuresExecutionEngine;
        this.pipelineMetrics = pipelineMetrics;
        this.eventPublisher = eventPublisher;
    }

    public ReviewRunResult run(Workflow workflow) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("workflowId", String.valueOf(workflow.getId()));
        MDC.put("userId", workflow.getUserId());
        MDC.put("runId", runId);
        long startedAt = System.currentTimeMillis();
        try {
            log.info("Workflow run start: mode={}, exchange={}", workflow.getMode(), workflow.getExchange());
            ReviewRunResult result = execute(workflow, runId);
            eventPublisher.publishEvent(new ReviewCompletedEvent(
                    this,
                    workflow.getId(),
                    result.getReviewResultId(),
                    result.isSuccess(),
                    result.isRebalance(),
                    System.currentTimeMillis() - startedAt));
            return result;
        } finally {
            MDC.remove("workflowId");
            MDC.remove("userId");
            MDC.remove("runId");
        }
    }

    private ReviewRunResult execute(Workflow workflow, String runId) {
        cleanupOpenOrders(workflow);

        RunState state = new RunState();
        try {
            AgentCredentials credentials = step("collectSnapshot", () -> {
                AgentCredentials resolved = credentialResolver.resolve(workflow);
                state.snapshot = snapshotCollector.collect(workflow);
                return resolved;
            });
            state.prompt = JsonHelper.toJson(state.snapshot);

            runAnalysts(workflow, state.snapshot);
            state.prompt = JsonHelper.toJson(state.snapshot);

            AgentResponse<? extends TradingDecision> response =
                    step("runDecisionAgent", () -> askAgent(workflow, credentials, state.snapshot));
            TradingDecision decision = response.getDecision();

            String validationError = step("validateDecision", () -> validate(workflow, response));
            if (validationError != null) {
                log.warn("Decision rejected: {}", validationError);
            }
            boolean valid = decision != null && validationError == null;
            boolean rebalance = valid && decision.hasInstructions();

            ReviewResult stored = step("persistResult", () -> {
                ReviewRawLog rawLog = reviewResultService.saveRawLog(
                        workflow.getId(), response.getPrompt(), response.getRawResponse());
                return reviewResultService.saveResult(ReviewResult.builder()
                        .workflowId(workflow.getId())
                        .rebalance(rebalance)
                        .shortReport(valid ? decision.getShortReport() : null)
                        .error(valid ? null : validationError)
                        .log(decision != null ? JsonHelper.toJson(decision) : null)
                        .rawLogId(rawLog.getId())
                        .build());
            });
            state.reviewResultId = stored.getId();

            boolean executed = false;
            if (rebalance && !workflow.isManualRebalance()) {
                step("executeDecision", () -> executeDecision(workflow, stored.getId(), decision));
                executed = true;
            } else if (rebalance) {
                log.info("Manual rebalance workflow, decision stored without execution: reviewResultId={}", stored.getId());
            }

            log.info("Workflow run complete: reviewResultId={}, rebalance={}, executed={}", stored.getId(), rebalance, executed);
            return ReviewRunResult.builder()
                    .workflowId(workflow.getId())
                    .runId(runId)
                    .reviewResultId(stored.getId())
                    .success(valid)
                    .rebalance(rebalance)
                    .executed(executed)
                    .error(valid ? null : validationError)
                    .build();
        } catch (RuntimeException e) {
            String message = messageOf(e);
            log.error("Workflow run failed: {}", message, e);
            Long resultId = state.reviewResultId != null ? state.reviewResultId : saveFailure(workflow, message, state);
            return ReviewRunResult.builder()
                    .workflowId(workflow.getId())
                    .runId(runId)
                    .reviewResultId(resultId)
                    .success(false)
                    .rebalance(false)
                    .error(message)
                    .build();
        }
    }

    // ---- Steps ----

    private void cleanupOpenOrders(Workflow workflow) {
        try {
            step("cleanupOpenOrders", () ->
                    openOrderCleaner.cancelOpenOrders(workflow.getId(), CancelReasons.UNFILLED_WITHIN_INTERVAL));
        } catch (RuntimeException e) {
            log.error("Open order cleanup failed, continuing run", e);
        }
    }

    private void runAnalysts(Workflow workflow, PortfolioSnapshot snapshot) {
        try {
            step("runAnalysts", () -> {
                snapshot.setReports(analystCoordinator.analyze(workflow));
                return null;
            });
        } catch (RuntimeException e) {
            log.error("Analysts failed, continuing without reports", e);
        }
    }

    private AgentResponse<? extends TradingDecision> askAgent(
            Workflow workflow, AgentCredentials credentials, PortfolioSnapshot snapshot) {
        boolean futures = workflow.getMode() == TradeMode.FUTURES;
        String instructions = workflow.getAgentInstructions() != null && !workflow.getAgentInstructions().isBlank()
                ? workflow.getAgentInstructions()
                : futures ? DecisionSchemas.FUTURES_INSTRUCTIONS : DecisionSchemas.SPOT_INSTRUCTIONS;
        if (futures) {
            return decisionAgent.decide(AgentRequest.<FuturesDecision>builder()
                    .model(credentials.model())
                    .apiKey(credentials.apiKey())
                    .instructions(instructions)
                    .schema(DecisionSchemas.futures())
                    .payload(snapshot)
                    .decisionType(FuturesDecision.class)
                    .build());
        }
        return decisionAgent.decide(AgentRequest.<SpotDecision>builder()
                .model(credentials.model())
                .apiKey(credentials.apiKey())
                .instructions(instructions)
                .schema(DecisionSchemas.spot())
                .payload(snapshot)
                .decisionType(SpotDecision.class)
                .build());
    }

    private String validate(Workflow workflow, AgentResponse<? extends TradingDecision> response) {
        TradingDecision decision = response.getDecision();
        if (decision == null) {
            return response.getRejection() != null ? NO_DECISION + ": " + response.getRejection() : NO_DECISION;
        }
        if (decision instanceof FuturesDecision futuresDecision) {
            return decisionValidator.validateFutures(workflow, futuresDecision);
        }
        return decisionValidator.validateSpot(workflow, (SpotDecision) decision);
    }

    private Object executeDecision(Workflow workflow, Long reviewResultId, TradingDecision decision) {
        if (decision instanceof FuturesDecision futuresDecision) {
            FuturesExecutionResult result =
                    futuresExecutionEngine.execute(workflow, reviewResultId, futuresDecision.getActions());
            log.info(
                    "Futures decision executed: executed={}, failed={}, skipped={}",
                    result.getExecuted(),
                    result.getFailed(),
                    result.getSkipped());
            return result;
        }
        RebalanceResult result =
                rebalanceOrderBuilder.execute(workflow, reviewResultId, ((SpotDecision) decision).getOrders());
        log.info(
                "Spot decision executed: placed={}, canceled={}, priceDivergenceCancellations={}",
                result.getPlaced(),
                result.getCanceled(),
                result.getPriceDivergenceCancellations());
        return result;
    }

    // ---- Failure ----

    private Long saveFailure(Workflow workflow, String message, RunState state) {
        try {
            ReviewRawLog rawLog = reviewResultService.saveRawLog(
                    workflow.getId(), state.prompt, JsonHelper.toJson(Map.of("error", message)));
            ReviewResult failure = reviewResultService.saveResult(ReviewResult.builder()
                    .workflowId(workflow.getId())
                    .rebalance(false)
                    .error(message)
                    .rawLogId(rawLog.getId())
                    .build());
            return failure.getId();
        } catch (RuntimeException e) {
            log.error("Failed to store failure result: {}", message, e);
            return null;
        }
    }

    private <T> T step(String name, Supplier<T> body) {
        log.info("Step start: step={}", name);
        long started = System.nanoTime();
        try {
            T result = body.get();
            pipelineMetrics.recordStep(name, System.nanoTime() - started, true);
            log.info("Step success: step={}", name);
            return result;
        } catch (RuntimeException e) {
            pipelineMetrics.recordStep(name, System.nanoTime() - started, false);
            log.error("Step failed: step={}, error={}", name, e.getMessage());
            throw e;
        }
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** Values that survive a failure for the failure result. */
    private static final class RunState {
        private PortfolioSnapshot snapshot;
        private String prompt;
        private Long reviewResultId;
    }
}
