package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display category of a pipeline status.
 */
public enum StatusCategory {
    READY("ready"),
    AGENT_RUNNING("agent_running"),
    HUMAN_REVIEW("human_review"),
    WAITING_FOR_INPUT("waiting_for_input"),
    TERMINAL("terminal");

    private final String value;

    StatusCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static StatusCategory fromValue(String value) {
        for (StatusCategory category : values()) {
            if (category.value.equals(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown status category: " + value);
    }
}
