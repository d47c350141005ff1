package com.agentflow.core.exception;

/**
 * Thrown when an agent is started on a task that already has an active phase.
 */
public class AgentAlreadyRunningException extends AgentFlowException {

    public static final String ERROR_CODE = "AGENT_ALREADY_RUNNING";

    public AgentAlreadyRunningException(String taskId, String activePhase, String agentRunId) {
        super(ERROR_CODE, String.format(
            "Task %s already has active phase '%s' (run %s)",
            taskId, activePhase, agentRunId
        ));
    }
}
