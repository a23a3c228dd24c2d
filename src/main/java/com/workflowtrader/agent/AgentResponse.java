package com.workflowtrader.agent;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a decision call. {@code decision} is null when the model answered with an error
 * or its answer failed parsing or validation; {@code rejection} then says why.
 */
@Getter
@AllArgsConstructor
public class AgentResponse<T extends TradingDecision> {

    /** Request body as sent, for the raw log. */
    private final String prompt;

    /** Response body as received, for the raw log. */
    private final String rawResponse;

    private final T decision;
    private final String rejection;

    public boolean hasDecision() {
        return decision != null;
    }
}
