package com.agentflow.core.exception;

/**
 * Thrown when a git or SCM platform call fails.
 */
public class ScmException extends AgentFlowException {

    public static final String ERROR_CODE = "SCM_FAILED";

    public ScmException(String message) {
        super(ERROR_CODE, message);
    }

    public ScmException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
