package com.agentflow.engine.guard;

import com.agentflow.core.model.*;
import com.agentflow.engine.support.EngineFixture;
import com.agentflow.engine.support.TestPipelines;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CoreGuardsTest {

    private EngineFixture fx;
    private CoreGuards guards;
    private Task task;
    private final Transition transition = Transition.manual("open", "in_progress");
    private final TransitionContext context = TransitionContext.manual("tester");

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        guards = new CoreGuards(fx.tasks, fx.pipelines, fx.phases, fx.runs);
        task = fx.createTask(TestPipelines.simple());
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    @DisplayName("has_pr passes only once a PR link is recorded")
    void hasPr() {
        assertThat(guards.hasPr(task, transition, context, Map.of()))
            .isEqualTo(GuardResult.deny("Task must have a PR link"));

        fx.tasks.updatePullRequest(task.id(), EngineFixture.PR_URL, "task/1", Instant.now());

        assertThat(guards.hasPr(fx.reload(task), transition, context, Map.of()).allowed()).isTrue();
    }

    @Test
    @DisplayName("dependencies_resolved counts dependencies outside a final status")
    void dependenciesResolved() {
        Task first = fx.createTask(TestPipelines.simple());
        Task second = fx.createTask(TestPipelines.simple());
        fx.tasks.addDependency(task.id(), first.id());
        fx.tasks.addDependency(task.id(), second.id());
        fx.tasks.addDependency(task.id(), "deleted-task");

        assertThat(guards.dependenciesResolved(task, transition, context, Map.of()).reason())
            .isEqualTo("2 unresolved dependencies");

        fx.tasks.updateStatus(first.id(), "open", "done", Instant.now());
        fx.tasks.updateStatus(second.id(), "open", "done", Instant.now());

        assertThat(guards.dependenciesResolved(task, transition, context, Map.of()).allowed()).isTrue();
    }

    @Test
    @DisplayName("no_running_agent names the active phase")
    void noRunningAgent() {
        assertThat(guards.noRunningAgent(task, transition, context, Map.of()).allowed()).isTrue();

        fx.phases.save(TaskPhase.activate(task.id(), "plan", "run-1", Instant.now()));

        assertThat(guards.noRunningAgent(task, transition, context, Map.of()).reason())
            .isEqualTo("An agent is already running for this task (phase 'plan')");
    }

    @Test
    @DisplayName("max_retries blocks once failed runs of the mode exceed the limit")
    void maxRetries() {
        failRun("implement");
        failRun("implement");
        failRun("plan");

        assertThat(guards.maxRetries(task, transition, context, Map.of("max", 2, "mode", "implement")).allowed())
            .isTrue();

        failRun("implement");

        GuardResult result = guards.maxRetries(task, transition, context, Map.of("max", 2, "mode", "implement"));
        assertThat(result.allowed()).isFalse();
        assertThat(result.reason()).isEqualTo("Max retries (2) exceeded for mode 'implement': 3 failed runs");
    }

    @Test
    @DisplayName("max_retries falls back to the latest phase and the default limit")
    void maxRetriesDefaults() {
        assertThat(guards.maxRetries(task, transition, context, Map.of()).allowed()).isTrue();

        for (int i = 0; i <= CoreGuards.DEFAULT_MAX_RETRIES; i++) {
            failRun("review");
        }
        fx.phases.save(TaskPhase.activate(task.id(), "review", "run-x", Instant.now()));

        assertThat(guards.maxRetries(task, transition, context, Map.of()).reason())
            .isEqualTo("Max retries (3) exceeded for mode 'review': 4 failed runs");
    }

    @Test
    @DisplayName("registerAll covers every built-in guard")
    void registerAll() {
        GuardRegistry registry = new GuardRegistry();
        guards.registerAll(registry);

        for (GuardKind kind : GuardKind.values()) {
            assertThat(registry.isRegistered(kind)).as(kind.guardName()).isTrue();
        }
    }

    private void failRun(String mode) {
        AgentRun run = AgentRun.start(task.id(), "scripted", mode, Instant.now());
        fx.runs.save(run);
        fx.runs.complete(run.withTerminal(AgentRunStatus.FAILED, "boom", "failed", null, 1, null, null, Instant.now()));
    }
}
