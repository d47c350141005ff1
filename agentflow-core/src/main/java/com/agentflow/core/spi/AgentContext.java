package com.agentflow.core.spi;

import com.agentflow.core.model.Project;
import com.agentflow.core.model.Task;

/**
 * Input handed to an agent capability.
 */
public record AgentContext(
    String runId,
    Task task,
    Project project,
    String workdir,
    String mode
) {
}
