package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Caller-supplied context of a transition request.
 *
 * @param trigger who requests the transition; null means manual
 * @param actor   free-form identity of the requester, may be null
 * @param data    extra data visible to guards and hooks, may be null
 */
public record TransitionContext(
    TransitionTrigger trigger,
    String actor,
    JsonNode data
) {
    public TransitionContext {
        trigger = trigger != null ? trigger : TransitionTrigger.MANUAL;
    }

    public static TransitionContext manual(String actor) {
        return new TransitionContext(TransitionTrigger.MANUAL, actor, null);
    }

    public static TransitionContext agent(String agentRunId, JsonNode data) {
        return new TransitionContext(TransitionTrigger.AGENT, "agent:" + agentRunId, data);
    }

    public static TransitionContext system(String actor) {
        return new TransitionContext(TransitionTrigger.SYSTEM, actor, null);
    }
}
