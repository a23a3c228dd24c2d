package com.workflowtrader.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Tuning of the review pipeline. Binds to {@code workflowtrader.pipeline.*}. */
@Configuration
@ConfigurationProperties(prefix = "workflowtrader.pipeline")
@Getter
@Setter
public class PipelineConfig {

    /** Number of previous review results included in a snapshot. */
    private int historySize = 5;

    private Analysis analysis = new Analysis();

    @Getter
    @Setter
    public static class Analysis {

        private String klineInterval = "1h";

        private int klineLimit = 200;

        /** TTL of cached analyst reports. */
        private int cacheTtlSeconds = 180;

        /** Upper bound on waiting for all analysts of one run. */
        private int timeoutSeconds = 60;
    }
}
