package com.agentflow.core.model;

/**
 * A guard that rejected a transition, with its reason.
 */
public record GuardFailure(String guard, String reason) {
}
