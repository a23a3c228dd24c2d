package com.workflowtrader.oms;

import lombok.Getter;

/** Outcome counts of one futures batch. executed + failed + skipped equals the batch size. */
@Getter
public class FuturesExecutionResult {

    private int executed;
    private int failed;
    private int skipped;

    void recordExecuted() {
        executed++;
    }

    void recordFailed() {
        failed++;
    }

    void recordSkipped() {
        skipped++;
    }
}
