package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Observational per-task log line. Never read back for control decisions.
 */
public record TaskEvent(
    String id,
    String taskId,
    EventCategory category,
    EventSeverity severity,
    String message,
    JsonNode data,
    Instant createdAt
) {
    public static TaskEvent of(
            String taskId,
            EventCategory category,
            EventSeverity severity,
            String message,
            JsonNode data,
            Instant now) {
        return new TaskEvent(UUID.randomUUID().toString(), taskId, category, severity, message, data, now);
    }
}
