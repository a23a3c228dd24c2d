package com.workflowtrader.oms;

import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.model.OpenLimitOrder;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Cancels every OPEN limit order of a workflow on the bounded cancellation pool.
 * A failed cancel is logged and leaves its order OPEN; it never fails the whole sweep.
 */
@Service
public class OpenOrderCleaner {

    private static final Logger log = LoggerFactory.getLogger(OpenOrderCleaner.class);

    private final OrderLedgerService orderLedgerService;
    private final LimitOrderCanceller limitOrderCanceller;
    private final Executor cancellationExecutor;

    public OpenOrderCleaner(
            OrderLedgerService orderLedgerService,
            LimitOrderCanceller limitOrderCanceller,
            @Qualifier("cancellationExecutor") Executor cancellationExecutor) {
        this.orderLedgerService = orderLedgerService;
        this.limitOrderCanceller = limitOrderCanceller;
        this.cancellationExecutor = cancellationExecutor;
    }

    public CleanupSummary cancelOpenOrders(Long workflowId, String reason) {
        List<OpenLimitOrder> openOrders = orderLedgerService.findOpenForWorkflow(workflowId);
        if (openOrders.isEmpty()) {
            return new CleanupSummary(0, 0, 0);
        }

        AtomicInteger canceled = new AtomicInteger();
        AtomicInteger filled = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        CompletableFuture<?>[] tasks = openOrders.stream()
                .map(order -> CompletableFuture.runAsync(
                        () -> {
                            try {
                                LimitOrderStatus outcome = limitOrderCanceller.cancel(order, reason);
                                if (outcome == LimitOrderStatus.FILLED) {
                                    filled.incrementAndGet();
                                } else {
                                    canceled.incrementAndGet();
                                }
                            } catch (RuntimeException e) {
                                failed.incrementAndGet();
                                log.error(
                                        "Failed to cancel limit order: workflowId={}, orderId={}, symbol={}",
                                        workflowId,
                                        order.getOrderId(),
                                        order.getSymbol(),
                                        e);
                            }
                        },
                        cancellationExecutor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(tasks).join();

        CleanupSummary summary = new CleanupSummary(canceled.get(), filled.get(), failed.get());
        log.info(
                "Open orders cleaned up: workflowId={}, reason={}, canceled={}, filled={}, failed={}",
                workflowId,
                reason,
                summary.canceled(),
                summary.filled(),
                summary.failed());
        return summary;
    }

    public record CleanupSummary(int canceled, int filled, int failed) {}
}
