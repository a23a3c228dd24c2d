package com.workflowtrader.review;

import com.workflowtrader.agent.SpotDecision;
import com.workflowtrader.agent.SpotOrderInstruction;
import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.enums.TradeMode;
import com.workflowtrader.domain.model.LimitOrder;
import com.workflowtrader.domain.model.OpenLimitOrder;
import com.workflowtrader.domain.model.ReviewResult;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.exception.ResourceNotFoundException;
import com.workflowtrader.exception.ValidationException;
import com.workflowtrader.exception.WorkflowAlreadyRunningException;
import com.workflowtrader.mapper.JsonHelper;
import com.workflowtrader.oms.CancelReasons;
import com.workflowtrader.oms.LimitOrderCanceller;
import com.workflowtrader.oms.OrderLedgerService;
import com.workflowtrader.oms.RebalanceOrderBuilder;
import com.workflowtrader.workflow.ReviewResultService;
import com.workflowtrader.workflow.WorkflowService;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * User-driven order actions on a stored review result.
 *
 * <p>A manual rebalance workflow only stores its decisions. The user then executes one order of
 * a stored spot decision, optionally overriding its price or quantity. The order goes through
 * {@link RebalanceOrderBuilder} like an automatic run and is held under the workflow's
 * {@link ConcurrencyGuard}. A result executes at most one manual order.
 *
 * <p>Any OPEN limit order of a result can be canceled by the user, whatever the workflow mode.
 */
@Service
public class ManualExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ManualExecutionService.class);

    private final WorkflowService workflowService;
    private final ReviewResultService reviewResultService;
    private final OrderLedgerService orderLedgerService;
    private final RebalanceOrderBuilder rebalanceOrderBuilder;
    private final LimitOrderCanceller limitOrderCanceller;
    private final ConcurrencyGuard concurrencyGuard;

    public ManualExecutionService(
            WorkflowService workflowService,
            ReviewResultService reviewResultService,
            OrderLedgerService orderLedgerService,
            RebalanceOrderBuilder rebalanceOrderBuilder,
            LimitOrderCanceller limitOrderCanceller,
            ConcurrencyGuard concurrencyGuard) {
        this.workflowService = workflowService;
        this.reviewResultService = reviewResultService;
        this.orderLedgerService = orderLedgerService;
        this.rebalanceOrderBuilder = rebalanceOrderBuilder;
        this.limitOrderCanceller = limitOrderCanceller;
        this.concurrencyGuard = concurrencyGuard;
    }

    /**
     * The stored order at {@code orderIndex} (0 when null), without touching the exchange.
     *
     * @throws ValidationException when the workflow is not manual rebalance, the result carries
     *     no executable decision, or the index is out of range
     */
    public SpotOrderInstruction previewOrder(Long workflowId, Long resultId, Integer orderIndex) {
        Workflow workflow = requireManualWorkflow(workflowId);
        SpotDecision decision = loadDecision(workflow, resultId);
        return pick(decision, orderIndex);
    }

    /**
     * Places one order of a stored decision.
     *
     * @param price replaces both the limit and the base price when given
     * @param quantity replaces the stored quantity when given
     * @return the ledger row of the placed order
     * @throws ValidationException when the request is invalid or the exchange side rejected the
     *     order; the message is the stored cancellation reason in the latter case
     * @throws WorkflowAlreadyRunningException while a review of the workflow is in flight
     */
    public LimitOrder executeOrder(
            Long workflowId, Long resultId, Integer orderIndex, BigDecimal price, BigDecimal quantity) {
        Workflow workflow = requireManualWorkflow(workflowId);
        SpotDecision decision = loadDecision(workflow, resultId);
        SpotOrderInstruction stored = pick(decision, orderIndex);
        SpotOrderInstruction instruction = withOverrides(stored, price, quantity);

        if (!concurrencyGuard.tryAcquire(workflowId)) {
            throw new WorkflowAlreadyRunningException(workflowId);
        }
        try {
            rebalanceOrderBuilder.execute(workflow, resultId, List.of(instruction));
        } finally {
            concurrencyGuard.release(workflowId);
        }

        LimitOrder created = ordersOf(resultId).stream()
                .max(Comparator.comparing(LimitOrder::getId))
                .orElseThrow(() -> new ValidationException("Failed to create limit order"));
        if (created.getStatus() == LimitOrderStatus.CANCELED) {
            log.warn(
                    "Manual order rejected: workflowId={}, reviewResultId={}, reason={}",
                    workflowId,
                    resultId,
                    created.getCancellationReason());
            throw new ValidationException(
                    created.getCancellationReason() != null ? created.getCancellationReason() : "Order rejected");
        }
        log.info(
                "Manual order placed: workflowId={}, reviewResultId={}, orderId={}, edited={}",
                workflowId,
                resultId,
                created.getOrderId(),
                price != null || quantity != null);
        return created;
    }

    /**
     * Cancels one OPEN limit order of a result on the user's request.
     *
     * @return FILLED when the order filled before the cancel landed, CANCELED otherwise
     * @throws ResourceNotFoundException when the result has no order with that exchange id
     * @throws ValidationException when the order is no longer OPEN
     */
    public LimitOrderStatus cancelOrder(Long workflowId, Long resultId, String orderId) {
        Workflow workflow = workflowService.getWorkflow(workflowId);
        LimitOrder order = ordersOf(resultId).stream()
                .filter(o -> workflowId.equals(o.getWorkflowId()) && Objects.equals(orderId, o.getOrderId()))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        if (order.getStatus() != LimitOrderStatus.OPEN) {
            throw new ValidationException("Order not open");
        }

        OpenLimitOrder open = new OpenLimitOrder(
                order.getId(),
                order.getUserId(),
                workflowId,
                order.getExchange(),
                order.getSymbol(),
                order.getOrderId(),
                workflow.getStatus());
        LimitOrderStatus outcome;
        try {
            outcome = limitOrderCanceller.cancel(open, CancelReasons.CANCELED_BY_USER);
        } catch (IllegalStateException e) {
            throw new ValidationException(e.getMessage());
        }
        log.info(
                "Order canceled by user: workflowId={}, reviewResultId={}, orderId={}, outcome={}",
                workflowId,
                resultId,
                orderId,
                outcome);
        return outcome;
    }

    // ---- Helpers ----

    private Workflow requireManualWorkflow(Long workflowId) {
        Workflow workflow = workflowService.getWorkflow(workflowId);
        if (!workflow.isManualRebalance()) {
            throw new ValidationException("Manual rebalance disabled");
        }
        if (workflow.getMode() != TradeMode.SPOT) {
            throw new ValidationException("Manual rebalance is only available for spot workflows");
        }
        return workflow;
    }

    private SpotDecision loadDecision(Workflow workflow, Long resultId) {
        ReviewResult result = reviewResultService.getForWorkflow(workflow.getId(), resultId);
        if (!ordersOf(resultId).isEmpty()) {
            throw new ValidationException("Order already exists for result");
        }
        if (!result.isRebalance() || result.getLog() == null) {
            throw new ValidationException("No rebalance info");
        }
        SpotDecision decision = JsonHelper.fromJson(result.getLog(), SpotDecision.class);
        if (decision == null || !decision.hasInstructions()) {
            throw new ValidationException("Decision contains no orders");
        }
        return decision;
    }

    private static SpotOrderInstruction pick(SpotDecision decision, Integer orderIndex) {
        int index = orderIndex != null ? orderIndex : 0;
        if (index < 0 || index >= decision.getOrders().size()) {
            throw new ValidationException("Invalid order index");
        }
        return decision.getOrders().get(index);
    }

    private static SpotOrderInstruction withOverrides(
            SpotOrderInstruction stored, BigDecimal price, BigDecimal quantity) {
        SpotOrderInstruction instruction = SpotOrderInstruction.builder()
                .pair(stored.getPair())
                .token(stored.getToken())
                .side(stored.getSide())
                .quantity(stored.getQuantity())
                .limitPrice(stored.getLimitPrice())
                .basePrice(stored.getBasePrice())
                .maxPriceDivergencePct(stored.getMaxPriceDivergencePct())
                .build();
        if (price != null) {
            if (price.signum() <= 0) {
                throw new ValidationException("Invalid price");
            }
            instruction.setLimitPrice(price);
            instruction.setBasePrice(price);
        }
        if (quantity != null) {
            if (quantity.signum() <= 0) {
                throw new ValidationException("Invalid quantity");
            }
            instruction.setQuantity(quantity);
        }
        return instruction;
    }

    private List<LimitOrder> ordersOf(Long resultId) {
        return orderLedgerService.findLimitOrdersForResults(List.of(resultId));
    }
}
