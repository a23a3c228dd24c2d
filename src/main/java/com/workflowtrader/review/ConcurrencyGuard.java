package com.workflowtrader.review;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Process-wide set of workflows with a review in progress.
 *
 * <p>{@link #tryAcquire} is an atomic check-and-add, so of two concurrent callers for the same
 * workflow exactly one gets {@code true}. The holder must call {@link #release} in a
 * {@code finally} block. Holds only within this JVM.
 */
@Component
public class ConcurrencyGuard {

    private final Set<Long> running = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(Long workflowId) {
        return running.add(workflowId);
    }

    public void release(Long workflowId) {
        running.remove(workflowId);
    }

    public boolean isRunning(Long workflowId) {
        return running.contains(workflowId);
    }

    public int runningCount() {
        return running.size();
    }
}
