package com.agentflow.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable audit record of a committed transition. Append-only.
 */
public record TransitionHistoryEntry(
    String id,
    String taskId,
    String fromStatus,
    String toStatus,
    TransitionTrigger trigger,
    String actor,
    Map<String, GuardResult> guardResults,
    Instant createdAt
) {
    public TransitionHistoryEntry {
        guardResults = guardResults == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(guardResults));
    }

    public static TransitionHistoryEntry record(
            String taskId,
            String fromStatus,
            String toStatus,
            TransitionTrigger trigger,
            String actor,
            Map<String, GuardResult> guardResults,
            Instant now) {
        return new TransitionHistoryEntry(
            UUID.randomUUID().toString(), taskId, fromStatus, toStatus,
            trigger, actor, guardResults, now
        );
    }
}
