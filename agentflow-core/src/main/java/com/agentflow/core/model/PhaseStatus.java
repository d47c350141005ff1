package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PhaseStatus {
    PENDING("pending"),
    ACTIVE("active"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    PhaseStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isActive() {
        return this == ACTIVE;
    }

    @JsonCreator
    public static PhaseStatus fromValue(String value) {
        for (PhaseStatus candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown PhaseStatus: " + value);
    }
}
