package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Directed edge between two statuses of a pipeline.
 *
 * Invariants:
 * - from and to are statuses of the owning pipeline
 * - agentOutcome is only set when trigger == AGENT
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Transition(
    String from,
    String to,
    TransitionTrigger trigger,
    List<TransitionGuard> guards,
    List<TransitionHook> hooks,
    String label,
    String agentOutcome
) {
    public Transition {
        trigger = trigger != null ? trigger : TransitionTrigger.MANUAL;
        guards = guards == null ? List.of() : List.copyOf(guards);
        hooks = hooks == null ? List.of() : List.copyOf(hooks);
    }

    public static Transition manual(String from, String to) {
        return new Transition(from, to, TransitionTrigger.MANUAL, List.of(), List.of(), null, null);
    }

    public static Transition onOutcome(String from, String to, String agentOutcome) {
        return new Transition(from, to, TransitionTrigger.AGENT, List.of(), List.of(), null, agentOutcome);
    }

    public Transition withGuards(List<TransitionGuard> newGuards) {
        return new Transition(from, to, trigger, newGuards, hooks, label, agentOutcome);
    }

    public Transition withHooks(List<TransitionHook> newHooks) {
        return new Transition(from, to, trigger, guards, newHooks, label, agentOutcome);
    }

    public boolean matches(String fromStatus, String toStatus, TransitionTrigger requested) {
        return from.equals(fromStatus) && to.equals(toStatus) && trigger == requested;
    }

    /**
     * Find a hook declaration of the given kind on this transition.
     */
    public TransitionHook hook(HookKind kind) {
        return hooks.stream().filter(h -> h.kind() == kind).findFirst().orElse(null);
    }
}
