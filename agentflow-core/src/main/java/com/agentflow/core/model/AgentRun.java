package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * One execution attempt of an agent against a task.
 *
 * Primary Key: id
 *
 * Invariants:
 * - created RUNNING together with its phase activation
 * - leaves RUNNING exactly once; terminal states are never reopened
 */
public record AgentRun(
    String id,
    String taskId,
    String agentType,
    String mode,
    AgentRunStatus status,
    String output,
    String outcome,
    JsonNode payload,
    Integer exitCode,
    Instant startedAt,
    Instant completedAt,
    Long costInputTokens,
    Long costOutputTokens
) {
    /**
     * Create a new run in RUNNING state.
     */
    public static AgentRun start(String taskId, String agentType, String mode, Instant now) {
        return new AgentRun(
            UUID.randomUUID().toString(),
            taskId,
            agentType,
            mode,
            AgentRunStatus.RUNNING,
            "",
            null,
            null,
            null,
            now,
            null,
            null,
            null
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Create a copy in a terminal state.
     */
    public AgentRun withTerminal(
            AgentRunStatus terminal,
            String newOutput,
            String newOutcome,
            JsonNode newPayload,
            Integer newExitCode,
            Long inputTokens,
            Long outputTokens,
            Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        return new AgentRun(
            id, taskId, agentType, mode, terminal,
            newOutput != null ? newOutput : output,
            newOutcome,
            newPayload,
            newExitCode,
            startedAt,
            now,
            inputTokens,
            outputTokens
        );
    }
}
