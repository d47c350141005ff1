package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EventCategory {
    STATUS_CHANGE("status_change"),
    AGENT("agent"),
    WORKSPACE("workspace"),
    GIT("git"),
    SCM("scm"),
    SYSTEM("system"),
    PROMPT("prompt");

    private final String value;

    EventCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static EventCategory fromValue(String value) {
        for (EventCategory candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown EventCategory: " + value);
    }
}
