package com.agentflow.core.model;

/**
 * Typed reasons a transition attempt did not commit.
 */
public enum TransitionError {
    PIPELINE_NOT_FOUND,
    TASK_NOT_FOUND,
    NO_TRANSITION,

    /**
     * The persisted status no longer matches the status the caller saw.
     */
    STALE_STATUS,

    GUARD_REJECTED
}
