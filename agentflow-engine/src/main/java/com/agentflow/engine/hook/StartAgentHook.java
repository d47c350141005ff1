package com.agentflow.engine.hook;

import com.agentflow.core.exception.AgentFlowException;
import com.agentflow.core.exception.HookExecutionException;
import com.agentflow.core.model.AgentRun;
import com.agentflow.core.model.EventCategory;
import com.agentflow.core.model.HookResult;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.Transition;
import com.agentflow.core.model.TransitionContext;
import com.agentflow.core.model.TransitionHook;
import com.agentflow.engine.logging.TaskEventRecorder;
import com.agentflow.engine.service.AgentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts an agent run for the task. Params: {@code mode}, {@code agentType}.
 */
public class StartAgentHook implements HookFunction {

    private static final Logger log = LoggerFactory.getLogger(StartAgentHook.class);

    private final AgentService agentService;
    private final TaskEventRecorder recorder;

    public StartAgentHook(AgentService agentService, TaskEventRecorder recorder) {
        this.agentService = agentService;
        this.recorder = recorder;
    }

    @Override
    public HookResult execute(Task task, Transition transition, TransitionContext context, TransitionHook hook) {
        String mode = hook.param("mode");
        String agentType = hook.param("agentType");
        if (mode == null || agentType == null) {
            throw new HookExecutionException("start_agent requires 'mode' and 'agentType' params");
        }

        try {
            AgentRun run = agentService.execute(task.id(), mode, agentType, null);
            log.info("start_agent launched run {} ({}/{}) for task {}", run.id(), agentType, mode, task.id());
            return HookResult.ok();
        } catch (AgentFlowException e) {
            recorder.error(task.id(), EventCategory.AGENT, "start_agent hook failed: " + e.getMessage(),
                TaskEventRecorder.data("mode", mode, "agentType", agentType, "errorCode", e.getErrorCode()));
            throw new HookExecutionException("start_agent failed: " + e.getMessage(), e);
        }
    }
}
