package com.workflowtrader.review;

import com.workflowtrader.domain.enums.ReviewInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/** Registers one cron task per {@link ReviewInterval}. */
@Configuration
public class ReviewScheduler implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(ReviewScheduler.class);

    private final ReviewTriggerService reviewTriggerService;

    @Value("${workflowtrader.scheduler.enabled:true}")
    private boolean enabled;

    public ReviewScheduler(ReviewTriggerService reviewTriggerService) {
        this.reviewTriggerService = reviewTriggerService;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        if (!enabled) {
            log.info("Review scheduler disabled");
            return;
        }
        for (ReviewInterval interval : ReviewInterval.values()) {
            registrar.addCronTask(() -> tick(interval), interval.getCron());
        }
        log.info("Review scheduler registered {} intervals", ReviewInterval.values().length);
    }

    void tick(ReviewInterval interval) {
        try {
            reviewTriggerService.runScheduled(interval);
        } catch (RuntimeException e) {
            log.error("Scheduled review tick failed: interval={}", interval.getCode(), e);
        }
    }
}
