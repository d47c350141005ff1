package com.agentflow.core.model;

import java.util.List;

/**
 * Result of a transition attempt. Blocked transitions are results, not exceptions.
 *
 * Invariants:
 * - success implies errorCode == null and an updated task
 * - guardFailures is non-empty only when errorCode == GUARD_REJECTED
 */
public record TransitionResult(
    boolean success,
    Task task,
    TransitionError errorCode,
    String error,
    List<GuardFailure> guardFailures,
    List<HookFailure> hookFailures
) {
    public TransitionResult {
        guardFailures = guardFailures == null ? List.of() : List.copyOf(guardFailures);
        hookFailures = hookFailures == null ? List.of() : List.copyOf(hookFailures);
    }

    public static TransitionResult committed(Task task, List<HookFailure> hookFailures) {
        return new TransitionResult(true, task, null, null, List.of(), hookFailures);
    }

    public static TransitionResult failed(TransitionError errorCode, String error) {
        return new TransitionResult(false, null, errorCode, error, List.of(), List.of());
    }

    public static TransitionResult rejected(List<GuardFailure> guardFailures) {
        String error = "Guard check failed: " + String.join(", ",
            guardFailures.stream().map(f -> f.guard() + " (" + f.reason() + ")").toList());
        return new TransitionResult(false, null, TransitionError.GUARD_REJECTED, error, guardFailures, List.of());
    }
}
