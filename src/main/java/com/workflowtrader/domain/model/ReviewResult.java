package com.workflowtrader.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Durable outcome of one review run. Exactly one is written per run, successful or not.
 * A failed run has {@code error} set and {@code rebalance} false.
 */
@Data
@Builder
public class ReviewResult {

    private Long id;
    private Long workflowId;
    private boolean rebalance;
    private String shortReport;
    private String error;

    /** Validated decision as JSON, null when the model produced none. */
    private String log;

    private Long rawLogId;
    private LocalDateTime createdAt;
}
