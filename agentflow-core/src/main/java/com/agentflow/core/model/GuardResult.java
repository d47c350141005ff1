package com.agentflow.core.model;

/**
 * Outcome of evaluating one guard.
 */
public record GuardResult(boolean allowed, String reason) {

    public static GuardResult allow() {
        return new GuardResult(true, null);
    }

    public static GuardResult deny(String reason) {
        return new GuardResult(false, reason);
    }
}
