package com.agentflow.core.exception;

/**
 * Thrown when an agent capability is missing or fails to execute.
 */
public class AgentExecutionException extends AgentFlowException {

    public static final String ERROR_CODE = "AGENT_EXECUTION_FAILED";

    public AgentExecutionException(String message) {
        super(ERROR_CODE, message);
    }

    public AgentExecutionException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
