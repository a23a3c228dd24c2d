package com.workflowtrader.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for review runs, analyst calls and order cancellations.
 *
 * <p>The workflow executor rejects when full instead of running on the caller, so a burst of
 * scheduled reviews never blocks the scheduler thread. The cancellation pool is fixed at the
 * configured size and queues the rest.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${workflowtrader.async.workflow.core-pool-size:4}")
    private int workflowCorePoolSize;

    @Value("${workflowtrader.async.workflow.max-pool-size:16}")
    private int workflowMaxPoolSize;

    @Value("${workflowtrader.async.workflow.queue-capacity:100}")
    private int workflowQueueCapacity;

    @Value("${workflowtrader.async.cancellation.pool-size:5}")
    private int cancellationPoolSize;

    @Value("${workflowtrader.async.analysis.pool-size:8}")
    private int analysisPoolSize;

    @Bean("workflowExecutor")
    public ThreadPoolTaskExecutor workflowExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workflowCorePoolSize);
        executor.setMaxPoolSize(workflowMaxPoolSize);
        executor.setQueueCapacity(workflowQueueCapacity);
        executor.setThreadNamePrefix("workflow-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }

    @Bean("cancellationExecutor")
    public ThreadPoolTaskExecutor cancellationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cancellationPoolSize);
        executor.setMaxPoolSize(cancellationPoolSize);
        executor.setThreadNamePrefix("cancel-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(analysisPoolSize);
        executor.setMaxPoolSize(analysisPoolSize);
        executor.setThreadNamePrefix("analysis-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return workflowExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
