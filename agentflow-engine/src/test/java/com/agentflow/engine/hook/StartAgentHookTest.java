package com.agentflow.engine.hook;

import com.agentflow.core.exception.AgentAlreadyRunningException;
import com.agentflow.core.exception.HookExecutionException;
import com.agentflow.core.model.*;
import com.agentflow.engine.logging.TaskEventRecorder;
import com.agentflow.engine.service.AgentService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class StartAgentHookTest {

    private final AgentService agentService = mock(AgentService.class);
    private final TaskEventRecorder recorder = mock(TaskEventRecorder.class);
    private final StartAgentHook hook = new StartAgentHook(agentService, recorder);

    private final Task task = Task.create("p1", "agent", "Add login page", null, "planning", 0, List.of(), null, null, Instant.now());
    private final Transition transition = Transition.manual("open", "planning");
    private final TransitionHook declared = new TransitionHook(HookKind.START_AGENT,
        Map.of("mode", "plan", "agentType", "scripted"), HookPolicy.REQUIRED);

    @Test
    @DisplayName("Starts a run with the declared mode and agent type")
    void startsRun() {
        when(agentService.execute(task.id(), "plan", "scripted", null))
            .thenReturn(AgentRun.start(task.id(), "scripted", "plan", Instant.now()));

        assertThat(hook.execute(task, transition, TransitionContext.manual(null), declared).success()).isTrue();
        verify(agentService).execute(task.id(), "plan", "scripted", null);
    }

    @Test
    @DisplayName("A refused start is recorded on the task and fails the hook")
    void startRefused() {
        when(agentService.execute(any(), any(), any(), any()))
            .thenThrow(new AgentAlreadyRunningException(task.id(), "plan", "run-1"));

        assertThatThrownBy(() -> hook.execute(task, transition, TransitionContext.manual(null), declared))
            .isInstanceOf(HookExecutionException.class)
            .hasCauseInstanceOf(AgentAlreadyRunningException.class);
        verify(recorder).error(eq(task.id()), eq(EventCategory.AGENT), startsWith("start_agent hook failed: "), anyMap());
    }

    @Test
    @DisplayName("Missing params fail before any run is attempted")
    void missingParams() {
        TransitionHook bare = TransitionHook.of(HookKind.START_AGENT, HookPolicy.REQUIRED);

        assertThatThrownBy(() -> hook.execute(task, transition, TransitionContext.manual(null), bare))
            .isInstanceOf(HookExecutionException.class);
        verifyNoInteractions(agentService);
    }
}
