package com.agentflow.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Agent mode slot of a task (plan, implement, review, ...).
 *
 * Invariants:
 * - at most one phase per task is ACTIVE at any time
 */
public record TaskPhase(
    String id,
    String taskId,
    String phase,
    PhaseStatus status,
    String agentRunId,
    Instant startedAt,
    Instant completedAt
) {
    public static TaskPhase activate(String taskId, String phase, String agentRunId, Instant now) {
        return new TaskPhase(
            UUID.randomUUID().toString(), taskId, phase, PhaseStatus.ACTIVE,
            agentRunId, now, null
        );
    }

    public boolean isActive() {
        return status.isActive();
    }
}
