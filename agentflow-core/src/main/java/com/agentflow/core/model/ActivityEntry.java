package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Global activity feed entry.
 */
public record ActivityEntry(
    String id,
    String action,
    String entityType,
    String entityId,
    String summary,
    JsonNode data,
    Instant createdAt
) {
    public static ActivityEntry of(
            String action,
            String entityType,
            String entityId,
            String summary,
            JsonNode data,
            Instant now) {
        return new ActivityEntry(UUID.randomUUID().toString(), action, entityType, entityId, summary, data, now);
    }
}
