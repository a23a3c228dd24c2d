package com.workflowtrader.review;

import lombok.Builder;
import lombok.Getter;

/** What one pipeline run left behind. */
@Getter
@Builder
public class ReviewRunResult {

    private final Long workflowId;
    private final String runId;
    private final Long reviewResultId;
    private final boolean success;
    private final boolean rebalance;
    private final boolean executed;
    private final String error;
}
