package com.workflowtrader.snapshot;

/** Model and AI key a run uses. Never serialized into prompts or logs. */
public record AgentCredentials(String model, String provider, String apiKey) {

    @Override
    public String toString() {
        return "AgentCredentials[model=" + model + ", provider=" + provider + ", apiKey=****]";
    }
}
