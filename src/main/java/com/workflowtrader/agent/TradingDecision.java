package com.workflowtrader.agent;

/** Common view of a spot or futures decision. */
public interface TradingDecision {

    String getShortReport();

    /** True when the decision carries a non-empty order or action list. */
    boolean hasInstructions();
}
