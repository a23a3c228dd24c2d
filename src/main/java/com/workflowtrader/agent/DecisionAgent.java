package com.workflowtrader.agent;

import com.workflowtrader.exception.DecisionAgentException;

public interface DecisionAgent {

    /**
     * Asks the model for a decision.
     *
     * @return a response whose decision is null when the answer was unusable
     * @throws DecisionAgentException when the model could not be reached or refused the request
     */
    <T extends TradingDecision> AgentResponse<T> decide(AgentRequest<T> request);
}
