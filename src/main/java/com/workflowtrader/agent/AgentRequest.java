package com.workflowtrader.agent;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * One decision call: developer instructions, the JSON schema the answer must follow, and the
 * snapshot payload. {@code decisionType} is what a valid answer is bound to.
 */
@Getter
@Builder
public class AgentRequest<T extends TradingDecision> {

    private final String model;
    private final String apiKey;
    private final String instructions;
    private final Map<String, Object> schema;
    private final Object payload;
    private final Class<T> decisionType;

    @Override
    public String toString() {
        return "AgentRequest[model=" + model + ", decisionType=" + decisionType.getSimpleName() + "]";
    }
}
