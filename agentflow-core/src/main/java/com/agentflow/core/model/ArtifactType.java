package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of facts collected from agent runs.
 */
public enum ArtifactType {
    BRANCH("branch"),
    PR("pr"),
    COMMIT("commit"),
    DIFF("diff"),
    DOCUMENT("document");

    private final String value;

    ArtifactType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ArtifactType fromValue(String value) {
        for (ArtifactType candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ArtifactType: " + value);
    }
}
