package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable fact collected from a run. Append-only.
 */
public record TaskArtifact(
    String id,
    String taskId,
    ArtifactType type,
    JsonNode data,
    Instant createdAt
) {
    public static TaskArtifact of(String taskId, ArtifactType type, JsonNode data, Instant now) {
        return new TaskArtifact(UUID.randomUUID().toString(), taskId, type, data, now);
    }
}
