package com.agentflow.core.model;

import com.agentflow.core.exception.PipelineConfigException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Known hook kinds. Pipelines reference hooks by name; a name with no
 * matching kind is rejected when the pipeline is loaded.
 */
public enum HookKind {
    NOTIFY("notify"),
    START_AGENT("start_agent"),
    LOG_ACTIVITY("log_activity"),
    MERGE_PR("merge_pr");

    private final String hookName;

    HookKind(String hookName) {
        this.hookName = hookName;
    }

    @JsonValue
    public String hookName() {
        return hookName;
    }

    @JsonCreator
    public static HookKind fromName(String name) {
        for (HookKind kind : values()) {
            if (kind.hookName.equals(name)) {
                return kind;
            }
        }
        throw new PipelineConfigException("hooks", "unknown hook '" + name + "'");
    }
}
