package com.workflowtrader.api.controller;

import com.workflowtrader.api.dto.request.ManualOrderRequest;
import com.workflowtrader.api.dto.response.OrderPreviewResponse;
import com.workflowtrader.api.dto.response.ReviewResultResponse;
import com.workflowtrader.api.dto.response.ReviewTriggerResponse;
import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.model.FuturesOrder;
import com.workflowtrader.domain.model.LimitOrder;
import com.workflowtrader.domain.model.ReviewResult;
import com.workflowtrader.oms.OrderLedgerService;
import com.workflowtrader.review.ManualExecutionService;
import com.workflowtrader.review.ReviewTriggerService;
import com.workflowtrader.workflow.ReviewResultService;
import com.workflowtrader.workflow.WorkflowDisableService;
import com.workflowtrader.workflow.WorkflowService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for running and inspecting workflows.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/workflows/{id}/review} -- start a review now (202, or 409 while one runs)</li>
 *   <li>{@code POST /api/workflows/{id}/stop} -- cancel open orders and deactivate</li>
 *   <li>{@code GET /api/workflows/{id}/results} -- recent review results with their orders</li>
 *   <li>{@code GET /api/workflows/{id}/results/{resultId}/rebalance/preview} -- a stored order of a
 *       manual rebalance workflow</li>
 *   <li>{@code POST /api/workflows/{id}/results/{resultId}/rebalance} -- execute one stored order (201)</li>
 *   <li>{@code POST /api/workflows/{id}/results/{resultId}/orders/{orderId}/cancel} -- cancel an open
 *       limit order</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/workflows")
@Validated
public class WorkflowController {

    private final ReviewTriggerService reviewTriggerService;
    private final WorkflowDisableService workflowDisableService;
    private final WorkflowService workflowService;
    private final ReviewResultService reviewResultService;
    private final OrderLedgerService orderLedgerService;
    private final ManualExecutionService manualExecutionService;

    public WorkflowController(
            ReviewTriggerService reviewTriggerService,
            WorkflowDisableService workflowDisableService,
            WorkflowService workflowService,
            ReviewResultService reviewResultService,
            OrderLedgerService orderLedgerService,
            ManualExecutionService manualExecutionService) {
        this.reviewTriggerService = reviewTriggerService;
        this.workflowDisableService = workflowDisableService;
        this.workflowService = workflowService;
        this.reviewResultService = reviewResultService;
        this.orderLedgerService = orderLedgerService;
        this.manualExecutionService = manualExecutionService;
    }

    @PostMapping("/{id}/review")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ReviewTriggerResponse triggerReview(@PathVariable Long id) {
        reviewTriggerService.triggerManual(id);
        return ReviewTriggerResponse.accepted(id);
    }

    @PostMapping("/{id}/stop")
    public Map<String, String> stopWorkflow(@PathVariable Long id) {
        workflowDisableService.stopWorkflow(id);
        return Map.of("message", "Workflow stopped");
    }

    @GetMapping("/{id}/results")
    public List<ReviewResultResponse> getResults(
            @PathVariable Long id, @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        workflowService.getWorkflow(id);
        List<ReviewResult> results = reviewResultService.findRecent(id, limit);
        List<Long> resultIds = results.stream().map(ReviewResult::getId).toList();

        Map<Long, List<LimitOrder>> limitOrders = orderLedgerService.findLimitOrdersForResults(resultIds).stream()
                .collect(Collectors.groupingBy(LimitOrder::getReviewResultId));
        Map<Long, List<FuturesOrder>> futuresOrders = orderLedgerService.findFuturesOrdersForResults(resultIds).stream()
                .collect(Collectors.groupingBy(FuturesOrder::getReviewResultId));

        return results.stream()
                .map(result -> ReviewResultResponse.from(
                        result,
                        limitOrders.getOrDefault(result.getId(), List.of()),
                        futuresOrders.getOrDefault(result.getId(), List.of())))
                .toList();
    }

    @GetMapping("/{id}/results/{resultId}/rebalance/preview")
    public OrderPreviewResponse previewManualOrder(
            @PathVariable Long id,
            @PathVariable Long resultId,
            @RequestParam(required = false) @PositiveOrZero Integer orderIndex) {
        return OrderPreviewResponse.from(manualExecutionService.previewOrder(id, resultId, orderIndex));
    }

    @PostMapping("/{id}/results/{resultId}/rebalance")
    @ResponseStatus(HttpStatus.CREATED)
    public ReviewResultResponse.OrderLine executeManualOrder(
            @PathVariable Long id,
            @PathVariable Long resultId,
            @RequestBody(required = false) ManualOrderRequest request) {
        ManualOrderRequest body = request != null ? request : new ManualOrderRequest();
        LimitOrder order = manualExecutionService.executeOrder(
                id, resultId, body.getOrderIndex(), body.getPrice(), body.getQuantity());
        return ReviewResultResponse.OrderLine.spot(order);
    }

    @PostMapping("/{id}/results/{resultId}/orders/{orderId}/cancel")
    public Map<String, String> cancelOrder(
            @PathVariable Long id, @PathVariable Long resultId, @PathVariable String orderId) {
        LimitOrderStatus status = manualExecutionService.cancelOrder(id, resultId, orderId);
        return Map.of("orderId", orderId, "status", status.name());
    }
}
