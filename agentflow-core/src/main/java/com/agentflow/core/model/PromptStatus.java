package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PromptStatus {
    PENDING("pending"),
    ANSWERED("answered"),
    EXPIRED("expired");

    private final String value;

    PromptStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PromptStatus fromValue(String value) {
        for (PromptStatus candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown PromptStatus: " + value);
    }
}
