package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.*;
import com.agentflow.engine.support.EngineFixture;
import com.agentflow.engine.support.TestPipelines;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Conditional writes the engine relies on for its exactly-once guarantees.
 */
class JdbcRepositoriesTest {

    private EngineFixture fx;
    private Task task;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        task = fx.createTask(TestPipelines.simple());
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    @DisplayName("Pipelines round-trip with guards, hooks and outcomes")
    void pipelineRoundTrip() {
        Pipeline agent = TestPipelines.agent();
        fx.pipelines.save(agent);

        Pipeline loaded = fx.pipelines.findById("agent").orElseThrow();

        assertThat(loaded).isEqualTo(agent);
        assertThat(loaded.initialStatus()).isEqualTo("open");
        assertThat(fx.pipelines.findAll()).extracting(Pipeline::id).containsExactlyInAnyOrder("simple", "agent");
    }

    @Test
    @DisplayName("Saving a pipeline again replaces it")
    void pipelineReplace() {
        Pipeline simple = TestPipelines.simple();
        fx.pipelines.save(new Pipeline(simple.id(), "Renamed", null, simple.taskType(),
            simple.statuses(), simple.transitions()));

        assertThat(fx.pipelines.findById("simple").orElseThrow().name()).isEqualTo("Renamed");
        assertThat(fx.pipelines.findAll()).hasSize(1);
    }

    @Test
    @DisplayName("Status updates apply only from the expected status")
    void conditionalStatusUpdate() {
        assertThat(fx.tasks.updateStatus(task.id(), "in_progress", "done", Instant.now())).isFalse();
        assertThat(fx.tasks.updateStatus(task.id(), "open", "in_progress", Instant.now())).isTrue();
        assertThat(fx.tasks.updateStatus(task.id(), "open", "in_progress", Instant.now())).isFalse();
        assertThat(fx.reload(task).status()).isEqualTo("in_progress");
        assertThat(fx.tasks.lockForUpdate("missing")).isFalse();
    }

    @Test
    @DisplayName("Plans and subtasks are stored with the task")
    void planStorage() {
        fx.tasks.updatePlan(task.id(), "1. a\n2. b", List.of(Subtask.open("a"), Subtask.open("b")), Instant.now());

        Task reloaded = fx.reload(task);
        assertThat(reloaded.plan()).isEqualTo("1. a\n2. b");
        assertThat(reloaded.subtasks()).containsExactly(Subtask.open("a"), Subtask.open("b"));
    }

    @Test
    @DisplayName("A run leaves RUNNING exactly once")
    void runCompletesOnce() {
        AgentRun run = AgentRun.start(task.id(), "scripted", "plan", Instant.now());
        fx.runs.save(run);
        assertThat(fx.runs.findRunning()).extracting(AgentRun::id).containsExactly(run.id());

        assertThat(fx.runs.updateOutput(run.id(), "partial")).isTrue();
        assertThat(fx.runs.complete(run.withTerminal(AgentRunStatus.CANCELLED, null, null, null, null, null, null, Instant.now())))
            .isTrue();
        assertThat(fx.runs.complete(run.withTerminal(AgentRunStatus.COMPLETED, "late", "plan_complete", null, 0, 10L, 20L, Instant.now())))
            .isFalse();
        assertThat(fx.runs.updateOutput(run.id(), "after the end")).isFalse();

        AgentRun stored = fx.runs.findById(run.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(AgentRunStatus.CANCELLED);
        assertThat(stored.output()).isEqualTo("partial");
        assertThat(stored.completedAt()).isNotNull();
        assertThat(fx.runs.findRunning()).isEmpty();
    }

    @Test
    @DisplayName("Finishing by run touches only the active phase of that run")
    void finishPhaseByRun() {
        fx.phases.save(TaskPhase.activate(task.id(), "plan", "run-1", Instant.now()));

        assertThat(fx.phases.finishByRun("run-2", PhaseStatus.COMPLETED, Instant.now())).isFalse();
        assertThat(fx.phases.finishByRun("run-1", PhaseStatus.COMPLETED, Instant.now())).isTrue();
        assertThat(fx.phases.finishByRun("run-1", PhaseStatus.FAILED, Instant.now())).isFalse();
        assertThat(fx.phases.findByTaskAndPhase(task.id(), "plan").orElseThrow().status())
            .isEqualTo(PhaseStatus.COMPLETED);
    }

    @Test
    @DisplayName("Answered prompts are not expired and expired prompts are not answered")
    void promptStates() {
        PendingPrompt answered = PendingPrompt.open(task.id(), "run-1", "needs_info", null, null, Instant.now());
        PendingPrompt open = PendingPrompt.open(task.id(), "run-1", "needs_info", null, null, Instant.now());
        fx.prompts.save(answered);
        fx.prompts.save(open);

        assertThat(fx.prompts.answer(answered.id(), fx.objectMapper.createObjectNode().put("a", 1), Instant.now())).isTrue();
        assertThat(fx.prompts.expireByRun("run-1")).isEqualTo(1);
        assertThat(fx.prompts.answer(open.id(), null, Instant.now())).isFalse();

        assertThat(fx.prompts.findById(answered.id()).orElseThrow().status()).isEqualTo(PromptStatus.ANSWERED);
        assertThat(fx.prompts.findById(open.id()).orElseThrow().status()).isEqualTo(PromptStatus.EXPIRED);
    }

    @Test
    @DisplayName("The latest artifact of a type is returned")
    void latestArtifact() {
        Instant earlier = Instant.parse("2026-01-01T10:00:00Z");
        fx.artifacts.append(TaskArtifact.of(task.id(), ArtifactType.PR,
            fx.objectMapper.createObjectNode().put("url", "old"), earlier));
        fx.artifacts.append(TaskArtifact.of(task.id(), ArtifactType.PR,
            fx.objectMapper.createObjectNode().put("url", "new"), earlier.plusSeconds(60)));
        fx.artifacts.append(TaskArtifact.of(task.id(), ArtifactType.BRANCH,
            fx.objectMapper.createObjectNode().put("branch", "task/x"), earlier.plusSeconds(120)));

        assertThat(fx.artifacts.findLatest(task.id(), ArtifactType.PR).orElseThrow().data().get("url").asText())
            .isEqualTo("new");
        assertThat(fx.artifacts.findByTask(task.id())).hasSize(3);
        assertThat(fx.artifacts.findLatest(task.id(), ArtifactType.DIFF)).isEmpty();
    }
}
