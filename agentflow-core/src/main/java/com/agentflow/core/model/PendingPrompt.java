package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Human-in-the-loop request raised by an agent that needs input.
 *
 * Invariants:
 * - PENDING moves to ANSWERED or EXPIRED exactly once
 */
public record PendingPrompt(
    String id,
    String taskId,
    String agentRunId,
    String promptType,
    JsonNode payload,
    JsonNode response,
    String resumeOutcome,
    PromptStatus status,
    Instant createdAt,
    Instant answeredAt
) {
    public static final String DEFAULT_RESUME_OUTCOME = "info_provided";
    public static final String RESUME_TO_STATUS = "resumeToStatus";

    public static PendingPrompt open(
            String taskId,
            String agentRunId,
            String promptType,
            JsonNode payload,
            String resumeOutcome,
            Instant now) {
        return new PendingPrompt(
            UUID.randomUUID().toString(), taskId, agentRunId, promptType, payload,
            null,
            resumeOutcome != null ? resumeOutcome : DEFAULT_RESUME_OUTCOME,
            PromptStatus.PENDING,
            now,
            null
        );
    }

    /**
     * Status the task was in when the prompt was raised, or null.
     */
    public String resumeToStatus() {
        if (payload == null || !payload.hasNonNull(RESUME_TO_STATUS)) {
            return null;
        }
        return payload.get(RESUME_TO_STATUS).asText();
    }

    public boolean isPending() {
        return status == PromptStatus.PENDING;
    }
}
