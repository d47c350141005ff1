package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * A code repository tasks are worked in.
 *
 * Primary Key: id
 */
public record Project(
    String id,
    String name,
    String path,
    JsonNode config,
    Instant createdAt
) {
    /**
     * Model name configured for agents of this project, or null.
     */
    public String configuredModel() {
        if (config == null || !config.hasNonNull("model")) {
            return null;
        }
        return config.get("model").asText();
    }
}
