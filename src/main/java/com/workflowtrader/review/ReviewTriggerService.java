package com.workflowtrader.review;

import com.workflowtrader.domain.enums.ReviewInterval;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.exception.ValidationException;
import com.workflowtrader.exception.WorkflowAlreadyRunningException;
import com.workflowtrader.workflow.WorkflowService;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Admits review runs through the {@link ConcurrencyGuard} and hands them to the workflow
 * executor.
 *
 * <p>The guard is acquired on the calling thread, so a manual trigger learns synchronously
 * that a run is already in flight. It is released when the run ends, whatever the outcome,
 * or immediately if the executor refuses the task.
 */
@Service
public class ReviewTriggerService {

    private static final Logger log = LoggerFactory.getLogger(ReviewTriggerService.class);

    private final WorkflowService workflowService;
    private final ReviewPipeline reviewPipeline;
    private final ConcurrencyGuard concurrencyGuard;
    private final Executor workflowExecutor;

    public ReviewTriggerService(
            WorkflowService workflowService,
            ReviewPipeline reviewPipeline,
            ConcurrencyGuard concurrencyGuard,
            @Qualifier("workflowExecutor") Executor workflowExecutor) {
        this.workflowService = workflowService;
        this.reviewPipeline = reviewPipeline;
        this.concurrencyGuard = concurrencyGuard;
        this.workflowExecutor = workflowExecutor;
    }

    /**
     * Starts a run for every active workflow on this interval that is not already running.
     *
     * @return number of runs started
     */
    public int runScheduled(ReviewInterval interval) {
        List<Workflow> due = workflowService.findActiveByInterval(interval);
        int started = 0;
        for (Workflow workflow : due) {
            if (!concurrencyGuard.tryAcquire(workflow.getId())) {
                log.debug("Workflow still running, skipping tick: workflowId={}, interval={}", workflow.getId(), interval);
                continue;
            }
            try {
                submit(workflow);
                started++;
            } catch (RejectedExecutionException e) {
                log.warn("Workflow executor full, skipping tick: workflowId={}, interval={}", workflow.getId(), interval);
            }
        }
        if (!due.isEmpty()) {
            log.info("Scheduled review tick: interval={}, due={}, started={}", interval.getCode(), due.size(), started);
        }
        return started;
    }

    /**
     * Starts a run for one workflow on behalf of a user.
     *
     * @throws WorkflowAlreadyRunningException if a run for this workflow is in flight
     * @throws ValidationException if the workflow is not active
     */
    public CompletableFuture<ReviewRunResult> triggerManual(Long workflowId) {
        Workflow workflow = workflowService.getWorkflow(workflowId);
        if (!workflow.isActive()) {
            throw new ValidationException("Workflow is not active");
        }
        if (!concurrencyGuard.tryAcquire(workflowId)) {
            throw new WorkflowAlreadyRunningException(workflowId);
        }
        log.info("Manual review triggered: workflowId={}", workflowId);
        return submit(workflow);
    }

    private CompletableFuture<ReviewRunResult> submit(Workflow workflow) {
        try {
            return CompletableFuture.supplyAsync(
                    () -> {
                        try {
                            return reviewPipeline.run(workflow);
                        } finally {
                            concurrencyGuard.release(workflow.getId());
                        }
                    },
                    workflowExecutor);
        } catch (RejectedExecutionException e) {
            concurrencyGuard.release(workflow.getId());
            throw e;
        }
    }
}
