package com.agentflow.recovery;

import java.time.Instant;

/**
 * A run found RUNNING at startup and closed by recovery.
 */
public record InterruptedRun(
    String runId,
    String taskId,
    String agentType,
    String mode,
    Instant startedAt
) {
}
