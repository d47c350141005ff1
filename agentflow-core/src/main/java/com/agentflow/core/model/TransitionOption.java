package com.agentflow.core.model;

import java.util.List;

/**
 * A candidate transition annotated with a dry-run guard evaluation.
 */
public record TransitionOption(
    Transition transition,
    boolean allowed,
    List<GuardFailure> guardFailures
) {
    public TransitionOption {
        guardFailures = guardFailures == null ? List.of() : List.copyOf(guardFailures);
    }
}
