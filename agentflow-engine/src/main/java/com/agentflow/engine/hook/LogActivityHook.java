package com.agentflow.engine.hook;

import com.agentflow.core.model.HookResult;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.Transition;
import com.agentflow.core.model.TransitionContext;
import com.agentflow.core.model.TransitionHook;
import com.agentflow.engine.logging.TaskEventRecorder;

/**
 * Writes a global activity entry for the transition.
 */
public class LogActivityHook implements HookFunction {

    static final String DEFAULT_ACTION = "transition";

    private final TaskEventRecorder recorder;

    public LogActivityHook(TaskEventRecorder recorder) {
        this.recorder = recorder;
    }

    @Override
    public HookResult execute(Task task, Transition transition, TransitionContext context, TransitionHook hook) {
        String action = hook.param("action") != null ? hook.param("action") : DEFAULT_ACTION;
        recorder.activity(action, "task", task.id(),
            String.format("%s: %s → %s", task.title(), transition.from(), transition.to()),
            TaskEventRecorder.data(
                "fromStatus", transition.from(),
                "toStatus", transition.to(),
                "trigger", context.trigger().value(),
                "actor", context.actor()));
        return HookResult.ok();
    }
}
