package com.agentflow.core.exception;

/**
 * Thrown by a hook that could not perform its side effect.
 */
public class HookExecutionException extends AgentFlowException {

    public static final String ERROR_CODE = "HOOK_FAILED";

    public HookExecutionException(String message) {
        super(ERROR_CODE, message);
    }

    public HookExecutionException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
