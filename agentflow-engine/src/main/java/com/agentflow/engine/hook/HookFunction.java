package com.agentflow.engine.hook;

import com.agentflow.core.model.HookResult;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.Transition;
import com.agentflow.core.model.TransitionContext;
import com.agentflow.core.model.TransitionHook;

/**
 * Side effect run after a transition has committed.
 *
 * A hook may report failure through its result or by throwing; the engine
 * converts a thrown exception into a failed result.
 */
@FunctionalInterface
public interface HookFunction {

    /**
     * @param task       the task as of the committed transition
     * @param transition the executed transition
     * @param context    caller context of the transition
     * @param hook       the hook declaration with its params
     */
    HookResult execute(Task task, Transition transition, TransitionContext context, TransitionHook hook);
}
