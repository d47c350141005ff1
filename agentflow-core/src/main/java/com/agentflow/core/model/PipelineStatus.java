package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A status a task can occupy within a pipeline.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineStatus(
    String name,
    String label,
    StatusCategory category,
    @JsonProperty("isFinal") boolean isFinal,
    int position
) {
    public static PipelineStatus of(String name, StatusCategory category, boolean isFinal) {
        return new PipelineStatus(name, name, category, isFinal, 0);
    }
}
