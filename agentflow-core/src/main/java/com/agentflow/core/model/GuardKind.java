package com.agentflow.core.model;

import com.agentflow.core.exception.PipelineConfigException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Known guard kinds. Pipelines reference guards by name; a name with no
 * matching kind is rejected when the pipeline is loaded.
 */
public enum GuardKind {
    /**
     * Task has a pull request link.
     */
    HAS_PR("has_pr"),

    /**
     * Every task this task depends on sits in a final status of its own pipeline.
     */
    DEPENDENCIES_RESOLVED("dependencies_resolved"),

    /**
     * No task phase is currently active.
     */
    NO_RUNNING_AGENT("no_running_agent"),

    /**
     * Failed runs for the current phase are within the configured threshold.
     */
    MAX_RETRIES("max_retries");

    private final String guardName;

    GuardKind(String guardName) {
        this.guardName = guardName;
    }

    @JsonValue
    public String guardName() {
        return guardName;
    }

    @JsonCreator
    public static GuardKind fromName(String name) {
        for (GuardKind kind : values()) {
            if (kind.guardName.equals(name)) {
                return kind;
            }
        }
        throw new PipelineConfigException("guards", "unknown guard '" + name + "'");
    }
}
