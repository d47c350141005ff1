package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who or what requested a transition.
 */
public enum TransitionTrigger {
    /**
     * A human, through the UI, CLI or REST API.
     */
    MANUAL("manual"),

    /**
     * The agent execution service, keyed on a reported outcome.
     */
    AGENT("agent"),

    /**
     * Internal automation (phase advancement, resumption).
     */
    SYSTEM("system");

    private final String value;

    TransitionTrigger(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TransitionTrigger fromValue(String value) {
        for (TransitionTrigger trigger : values()) {
            if (trigger.value.equalsIgnoreCase(value)) {
                return trigger;
            }
        }
        throw new IllegalArgumentException("Unknown transition trigger: " + value);
    }
}
