package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a hook failure affects the remaining hooks of a transition.
 * The status change itself is never rolled back.
 */
public enum HookPolicy {
    /**
     * Failure stops the remaining hooks and is reported in the result.
     */
    REQUIRED("required"),

    /**
     * Failure is reported and logged as a warning; later hooks still run.
     */
    BEST_EFFORT("best_effort"),

    /**
     * Failure is logged only.
     */
    FIRE_AND_FORGET("fire_and_forget");

    private final String value;

    HookPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static HookPolicy fromValue(String value) {
        for (HookPolicy policy : values()) {
            if (policy.value.equals(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown hook policy: " + value);
    }
}
