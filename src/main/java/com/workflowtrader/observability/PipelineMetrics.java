package com.workflowtrader.observability;

import com.workflowtrader.event.FuturesOrderEvent;
import com.workflowtrader.event.LimitOrderEvent;
import com.workflowtrader.event.ReviewCompletedEvent;
import com.workflowtrader.review.ConcurrencyGuard;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics of the review engine:
 * <ul>
 *   <li><b>review.runs</b> (counter, tag outcome): completed runs</li>
 *   <li><b>review.rebalances</b> (counter): runs whose decision carried orders or actions</li>
 *   <li><b>review.duration</b> (timer): wall time of a whole run</li>
 *   <li><b>review.step</b> (timer, tags step and outcome): wall time per pipeline step</li>
 *   <li><b>limit.orders</b> (counter, tag status): limit order state changes</li>
 *   <li><b>futures.orders</b> (counter, tag status): recorded futures actions</li>
 *   <li><b>review.running</b> (gauge): workflows currently held by the guard</li>
 * </ul>
 * Run and order counters are fed by application events.
 */
@Service
public class PipelineMetrics {

    private static final Logger log = LoggerFactory.getLogger(PipelineMetrics.class);

    private final MeterRegistry meterRegistry;
    private final Counter successfulRunCounter;
    private final Counter failedRunCounter;
    private final Counter rebalanceCounter;
    private final Timer runDurationTimer;

    public PipelineMetrics(MeterRegistry meterRegistry, ConcurrencyGuard concurrencyGuard) {
        this.meterRegistry = meterRegistry;

        this.successfulRunCounter = Counter.builder("review.runs")
                .tag("outcome", "success")
                .description("Review runs that stored a result without error")
                .register(meterRegistry);

        this.failedRunCounter = Counter.builder("review.runs")
                .tag("outcome", "failure")
                .description("Review runs that stored a failure result")
                .register(meterRegistry);

        this.rebalanceCounter = Counter.builder("review.rebalances")
                .description("Review runs with a non-empty decision")
                .register(meterRegistry);

        this.runDurationTimer = Timer.builder("review.duration")
                .description("Wall time of a review run")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofMinutes(10))
                .register(meterRegistry);

        meterRegistry.gauge("review.running", concurrencyGuard, ConcurrencyGuard::runningCount);
    }

    public void recordStep(String step, long elapsedNanos, boolean success) {
        Timer.builder("review.step")
                .tag("step", step)
                .tag("outcome", success ? "success" : "failure")
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    @EventListener
    @Order(20)
    public void onReviewCompleted(ReviewCompletedEvent event) {
        if (event.isSuccess()) {
            successfulRunCounter.increment();
        } else {
            failedRunCounter.increment();
        }
        if (event.isRebalance()) {
            rebalanceCounter.increment();
        }
        runDurationTimer.record(event.getDurationMillis(), TimeUnit.MILLISECONDS);
    }

    @EventListener
    @Order(20)
    public void onLimitOrderEvent(LimitOrderEvent event) {
        meterRegistry.counter("limit.orders", "status", event.getStatus().name()).increment();
        if (event.getPreviousStatus() != null) {
            log.debug(
                    "Limit order transition: id={}, {} -> {}",
                    event.getLimitOrderId(),
                    event.getPreviousStatus(),
                    event.getStatus());
        }
    }

    @EventListener
    @Order(20)
    public void onFuturesOrderEvent(FuturesOrderEvent event) {
        meterRegistry.counter("futures.orders", "status", event.getStatus().name()).increment();
    }
}
