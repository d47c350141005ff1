package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of an agent run. A run leaves RUNNING exactly once.
 */
public enum AgentRunStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    TIMED_OUT("timed_out"),
    CANCELLED("cancelled");

    private final String value;

    AgentRunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Terminal states are never reopened; a retry creates a new run.
     */
    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonCreator
    public static AgentRunStatus fromValue(String value) {
        for (AgentRunStatus candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown AgentRunStatus: " + value);
    }
}
