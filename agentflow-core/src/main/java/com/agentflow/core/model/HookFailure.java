package com.agentflow.core.model;

/**
 * A hook that failed after a transition committed.
 */
public record HookFailure(String hook, HookPolicy policy, String error) {
}
