package com.agentflow.core.exception;

/**
 * Thrown when a workspace cannot be prepared, locked or released.
 */
public class WorkspaceException extends AgentFlowException {

    public static final String ERROR_CODE = "WORKSPACE_FAILED";

    public WorkspaceException(String message) {
        super(ERROR_CODE, message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
