package com.agentflow.core.spi;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * State of a pull request as reported by the SCM platform.
 */
public enum PullRequestStatus {
    OPEN("open"),
    CLOSED("closed"),
    MERGED("merged");

    private final String value;

    PullRequestStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PullRequestStatus fromValue(String value) {
        for (PullRequestStatus candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown PullRequestStatus: " + value);
    }
}
