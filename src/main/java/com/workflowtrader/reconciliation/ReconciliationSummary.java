package com.workflowtrader.reconciliation;

import lombok.Getter;

/** Counters of one reconciliation sweep. */
@Getter
public class ReconciliationSummary {

    private int scanned;
    private int groups;
    private int filled;
    private int canceled;
    private int unresolved;
    private int failedGroups;

    void addScanned(int count) {
        scanned += count;
    }

    void recordGroup() {
        groups++;
    }

    void recordFilled() {
        filled++;
    }

    void recordCanceled() {
        canceled++;
    }

    void recordUnresolved() {
        unresolved++;
    }

    void recordFailedGroup() {
        failedGroups++;
    }

    @Override
    public String toString() {
        return "scanned=" + scanned + ", groups=" + groups + ", filled=" + filled + ", canceled=" + canceled
                + ", unresolved=" + unresolved + ", failedGroups=" + failedGroups;
    }
}
