package com.agentflow.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What an agent capability reports back.
 */
public record AgentResult(
    int exitCode,
    String output,
    String outcome,
    JsonNode payload,
    Long costInputTokens,
    Long costOutputTokens,
    String error
) {
    public static AgentResult success(String output, String outcome, JsonNode payload) {
        return new AgentResult(0, output, outcome, payload, null, null, null);
    }

    public static AgentResult failure(int exitCode, String output, String error) {
        return new AgentResult(exitCode, output, null, null, null, null, error);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
