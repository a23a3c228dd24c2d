package com.workflowtrader.reconciliation;

import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.domain.enums.WorkflowStatus;
import com.workflowtrader.domain.model.OpenLimitOrder;
import com.workflowtrader.exception.ExchangeException;
import com.workflowtrader.exchange.ExchangeGatewayRegistry;
import com.workflowtrader.exchange.SpotTradingModule;
import com.workflowtrader.exchange.model.ExchangeOrderState;
import com.workflowtrader.exchange.model.SpotOpenOrder;
import com.workflowtrader.oms.CancelReasons;
import com.workflowtrader.oms.LimitOrderCanceller;
import com.workflowtrader.oms.OrderLedgerService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically brings OPEN limit orders in the ledger in line with the exchange.
 *
 * <p>Open orders are grouped by (user, exchange, symbol) so each group costs one open-orders
 * call. For every order in a group:
 * <ul>
 *   <li>still open on the exchange and its workflow is active: left alone</li>
 *   <li>still open and its workflow is not active: canceled ("Workflow inactive")</li>
 *   <li>gone from the open list: fetched; FILLED is recorded, a closed status is recorded as
 *       CANCELED with a description of what the exchange did, anything else stays OPEN</li>
 *   <li>unknown to the exchange: CANCELED</li>
 * </ul>
 * All writes are conditional on the row still being OPEN (except a fill, which may overwrite
 * a cancellation), so a second sweep over the same exchange state writes nothing.
 *
 * <p>Cancels for inactive workflows are collected during the sweep and run on the bounded
 * {@code cancellationExecutor} shared with {@link com.workflowtrader.oms.OpenOrderCleaner};
 * the sweep waits for them before reporting.
 */
@Service
public class OrderReconciler {

    private static final Logger log = LoggerFactory.getLogger(OrderReconciler.class);

    static final Map<String, String> CLOSED_STATUS_DESCRIPTIONS = Map.of(
            "CANCELED", "canceled the order",
            "PENDING_CANCEL", "marked the order as pending cancellation",
            "EXPIRED", "expired the order before it could fill",
            "REJECTED", "rejected the order",
            "EXPIRED_IN_MATCH", "expired the order while matching",
            "CANCELLED", "canceled the order",
            "DEACTIVATED", "deactivated the order");

    private final OrderLedgerService orderLedgerService;
    private final LimitOrderCanceller limitOrderCanceller;
    private final ExchangeGatewayRegistry gatewayRegistry;
    private final Executor cancellationExecutor;

    public OrderReconciler(
            OrderLedgerService orderLedgerService,
            LimitOrderCanceller limitOrderCanceller,
            ExchangeGatewayRegistry gatewayRegistry,
            @Qualifier("cancellationExecutor") Executor cancellationExecutor) {
        this.orderLedgerService = orderLedgerService;
        this.limitOrderCanceller = limitOrderCanceller;
        this.gatewayRegistry = gatewayRegistry;
        this.cancellationExecutor = cancellationExecutor;
    }

    @Scheduled(
            fixedDelayString = "${workflowtrader.reconciliation.interval-ms:180000}",
            initialDelayString = "${workflowtrader.reconciliation.initial-delay-ms:60000}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Order reconciliation sweep failed", e);
        }
    }

    public ReconciliationSummary sweep() {
        ReconciliationSummary summary = new ReconciliationSummary();
        List<OpenLimitOrder> openOrders = orderLedgerService.findAllOpen();
        if (openOrders.isEmpty()) {
            return summary;
        }
        summary.addScanned(openOrders.size());

        List<OpenLimitOrder> inactiveCancels = new ArrayList<>();
        for (List<OpenLimitOrder> group : groupOrders(openOrders).values()) {
            summary.recordGroup();
            OpenLimitOrder first = group.get(0);
            try {
                reconcileGroup(group, summary, inactiveCancels);
            } catch (RuntimeException e) {
                summary.recordFailedGroup();
                log.error(
                        "Failed to reconcile order group: userId={}, exchange={}, symbol={}",
                        first.getUserId(),
                        first.getExchange(),
                        first.getSymbol(),
                        e);
            }
        }

        cancelForInactiveWorkflows(inactiveCancels, summary);

        log.info("Order reconciliation finished: {}", summary);
        return summary;
    }

    private void cancelForInactiveWorkflows(List<OpenLimitOrder> orders, ReconciliationSummary summary) {
        if (orders.isEmpty()) {
            return;
        }
        List<CompletableFuture<LimitOrderStatus>> tasks = orders.stream()
                .map(order -> CompletableFuture.supplyAsync(() -> cancelInactive(order), cancellationExecutor))
                .toList();
        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();

        for (CompletableFuture<LimitOrderStatus> task : tasks) {
            LimitOrderStatus outcome = task.join();
            if (outcome == LimitOrderStatus.FILLED) {
                summary.recordFilled();
            } else if (outcome == LimitOrderStatus.CANCELED) {
                summary.recordCanceled();
            } else {
                summary.recordUnresolved();
            }
        }
    }

    /** Null when the cancel failed; the order stays OPEN for the next sweep. */
    private LimitOrderStatus cancelInactive(OpenLimitOrder order) {
        try {
            return limitOrderCanceller.cancel(order, CancelReasons.WORKFLOW_INACTIVE);
        } catch (RuntimeException e) {
            log.error(
                    "Failed to cancel order of inactive workflow: id={}, orderId={}, workflowId={}",
                    order.getId(),
                    order.getOrderId(),
                    order.getWorkflowId(),
                    e);
            return null;
        }
    }

    // ---- Grouping ----

    private static Map<GroupKey, List<OpenLimitOrder>> groupOrders(List<OpenLimitOrder> orders) {
        return orders.stream()
                .collect(Collectors.groupingBy(
                        o -> new GroupKey(o.getUserId(), o.getExchange(), o.getSymbol()),
                        LinkedHashMap::new,
                        Collectors.toList()));
    }

    private record GroupKey(String userId, SupportedExchange exchange, String symbol) {}

    // ---- Per group ----

    private void reconcileGroup(
            List<OpenLimitOrder> group, ReconciliationSummary summary, List<OpenLimitOrder> inactiveCancels) {
        OpenLimitOrder first = group.get(0);
        Optional<SpotTradingModule> spot = gatewayRegistry.forExchange(first.getExchange()).spot();
        if (spot.isEmpty()) {
            log.warn(
                    "Open orders on exchange without spot support: exchange={}, count={}",
                    first.getExchange(),
                    group.size());
            group.forEach(o -> summary.recordUnresolved());
            return;
        }

        List<SpotOpenOrder> live;
        try {
            live = spot.get().fetchOpenOrders(first.getUserId(), first.getSymbol());
        } catch (RuntimeException e) {
            summary.recordFailedGroup();
            log.error(
                    "Failed to fetch open orders: userId={}, exchange={}, symbol={}, error={}",
                    first.getUserId(),
                    first.getExchange(),
                    first.getSymbol(),
                    e.getMessage());
            return;
        }
        Set<String> liveIds = live == null
                ? Set.of()
                : live.stream().map(SpotOpenOrder::getOrderId).collect(Collectors.toSet());

        for (OpenLimitOrder order : group) {
            try {
                reconcileOrder(spot.get(), order, liveIds, summary, inactiveCancels);
            } catch (RuntimeException e) {
                summary.recordUnresolved();
                log.error("Failed to reconcile order: id={}, orderId={}", order.getId(), order.getOrderId(), e);
            }
        }
    }

    // ---- Per order ----

    private void reconcileOrder(
            SpotTradingModule spot,
            OpenLimitOrder order,
            Set<String> liveIds,
            ReconciliationSummary summary,
            List<OpenLimitOrder> inactiveCancels) {
        if (liveIds.contains(order.getOrderId())) {
            if (order.getWorkflowStatus() != WorkflowStatus.ACTIVE) {
                inactiveCancels.add(order);
            }
            return;
        }

        ClosedResolution resolution = resolveClosed(spot, order);
        if (resolution == null) {
            summary.recordUnresolved();
        } else if (resolution.filled()) {
            if (orderLedgerService.markFilled(order)) {
                summary.recordFilled();
            }
        } else if (orderLedgerService.markCanceledIfOpen(order, resolution.reason())) {
            summary.recordCanceled();
        }
    }

    /** Null when the final state cannot be determined this sweep. */
    private ClosedResolution resolveClosed(SpotTradingModule spot, OpenLimitOrder order) {
        ExchangeOrderState state;
        try {
            state = spot.fetchOrder(order.getUserId(), order.getSymbol(), order.getOrderId());
        } catch (ExchangeException e) {
            if (e.isOrderNotFound()) {
                return ClosedResolution.canceled(notFoundReason(e));
            }
            log.error(
                    "Failed to fetch order while reconciling: orderId={}, exchange={}, error={}",
                    order.getOrderId(),
                    order.getExchange(),
                    e.getMessage());
            return null;
        }

        if (state == null || state.getStatus() == null) {
            log.error("Missing order status while reconciling: orderId={}", order.getOrderId());
            return null;
        }
        String status = state.getStatus().toUpperCase(Locale.ROOT);
        if (state.isFilled()) {
            return ClosedResolution.FILLED;
        }
        if (CLOSED_STATUS_DESCRIPTIONS.containsKey(status)) {
            return ClosedResolution.canceled(externalCancellationReason(order.getExchange(), status));
        }
        log.error("Unexpected order status while reconciling: orderId={}, status={}", order.getOrderId(), status);
        return null;
    }

    static String externalCancellationReason(SupportedExchange exchange, String status) {
        String description = CLOSED_STATUS_DESCRIPTIONS.getOrDefault(status, "closed the order");
        return exchange.getDisplayName() + " " + description + " (status " + status + ")";
    }

    static String notFoundReason(ExchangeException e) {
        String name = e.getExchange().getDisplayName();
        String message = e.getMessage() != null ? e.getMessage().trim() : "";
        if (!message.isEmpty()) {
            return name + ": " + message;
        }
        return name + " could not find the order (code " + e.getExchangeCode() + ")";
    }

    private record ClosedResolution(boolean filled, String reason) {

        static final ClosedResolution FILLED = new ClosedResolution(true, null);

        static ClosedResolution canceled(String reason) {
            return new ClosedResolution(false, reason);
        }
    }
}
