package com.agentflow.engine.guard;

import com.agentflow.core.model.GuardResult;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.Transition;
import com.agentflow.core.model.TransitionContext;

import java.util.Map;

/**
 * Side-effect-free predicate gating a transition. May read persisted
 * state, never writes it.
 */
@FunctionalInterface
public interface GuardFunction {

    GuardResult evaluate(Task task, Transition transition, TransitionContext context, Map<String, Object> params);
}
