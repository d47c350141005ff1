package com.agentflow.core.exception;

/**
 * Thrown when answering a prompt that is already answered or expired.
 */
public class PromptNotPendingException extends AgentFlowException {

    public static final String ERROR_CODE = "PROMPT_NOT_PENDING";

    public PromptNotPendingException(String promptId, String status) {
        super(ERROR_CODE, String.format(
            "Prompt %s is %s, expected pending",
            promptId, status
        ));
    }
}
