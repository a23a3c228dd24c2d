package com.workflowtrader.oms;

import lombok.Getter;

/** Counts produced by one rebalance. Every input order lands in exactly one of placed or canceled. */
@Getter
public class RebalanceResult {

    private int placed;
    private int canceled;
    private int priceDivergenceCancellations;

    void recordPlaced() {
        placed++;
    }

    void recordCanceled(boolean priceDivergence) {
        canceled++;
        if (priceDivergence) {
            priceDivergenceCancellations++;
        }
    }

    /** Every order that reached the divergence guard was stopped by it and nothing was placed. */
    public boolean needsPriceDivergenceRetry() {
        return priceDivergenceCancellations > 0 && placed == 0;
    }
}
