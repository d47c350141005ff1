package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Progress marker of a plan subtask.
 */
public enum SubtaskStatus {
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    DONE("done");

    private final String value;

    SubtaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SubtaskStatus fromValue(String value) {
        for (SubtaskStatus candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown SubtaskStatus: " + value);
    }
}
