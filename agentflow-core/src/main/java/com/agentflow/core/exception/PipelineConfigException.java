package com.agentflow.core.exception;

/**
 * Thrown when a pipeline definition is invalid.
 * Raised when a pipeline is loaded or saved, never per transition.
 */
public class PipelineConfigException extends AgentFlowException {

    public static final String ERROR_CODE = "PIPELINE_CONFIG_INVALID";

    private final String field;

    public PipelineConfigException(String field, String message) {
        super(ERROR_CODE, String.format(
            "Invalid pipeline config (%s): %s",
            field, message
        ));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
