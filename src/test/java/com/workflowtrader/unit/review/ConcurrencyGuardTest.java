package com.workflowtrader.unit.review;

import static org.assertj.core.api.Assertions.assertThat;

import com.workflowtrader.review.ConcurrencyGuard;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConcurrencyGuardTest {

    private ConcurrencyGuard guard;

    @BeforeEach
    void setUp() {
        guard = new ConcurrencyGuard();
    }

    @Test
    @DisplayName("Second acquire for the same workflow fails until released")
    void acquireReleaseCycle() {
        assertThat(guard.tryAcquire(1L)).isTrue();
        assertThat(guard.tryAcquire(1L)).isFalse();
        assertThat(guard.isRunning(1L)).isTrue();

        guard.release(1L);

        assertThat(guard.isRunning(1L)).isFalse();
        assertThat(guard.tryAcquire(1L)).isTrue();
    }

    @Test
    @DisplayName("Different workflows do not block each other")
    void independentWorkflows() {
        assertThat(guard.tryAcquire(1L)).isTrue();
        assertThat(guard.tryAcquire(2L)).isTrue();
        assertThat(guard.runningCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Exactly one of many concurrent callers acquires the same workflow")
    void concurrentAcquire() throws InterruptedException {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger winners = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            pool.submit(() -> {
                try {
                    start.await();
                    if (guard.tryAcquire(42L)) {
                        winners.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        pool.shutdownNow();

        assertThat(winners.get()).isEqualTo(1);
    }
}
