package com.agentflow.recovery;

import com.agentflow.core.model.AgentRun;
import com.agentflow.core.model.AgentRunStatus;
import com.agentflow.core.model.PendingPrompt;
import com.agentflow.core.model.PhaseStatus;
import com.agentflow.core.model.PromptStatus;
import com.agentflow.engine.metrics.AgentFlowMetrics;
import com.agentflow.recovery.support.RecoveryFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("Startup recovery")
class StartupRecoveryTest {

    private RecoveryFixture fixture;
    private StartupRecovery recovery;

    @BeforeEach
    void setUp() {
        fixture = new RecoveryFixture();
        recovery = new StartupRecovery(fixture.runs, fixture.runTerminator, fixture.metrics);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    @DisplayName("Runs left running are closed as timed out with outcome interrupted")
    void closesOrphanedRuns() {
        AgentRun planning = fixture.runningRun("task-1", "scripted", "plan");
        AgentRun implementing = fixture.runningRun("task-2", "scripted", "implement");
        PendingPrompt prompt = fixture.openPrompt(planning);

        fixture.time.advanceMinutes(3);
        List<InterruptedRun> interrupted = recovery.recover();

        assertThat(interrupted)
            .extracting(InterruptedRun::runId)
            .containsExactlyInAnyOrder(planning.id(), implementing.id());
        assertThat(recovery.isCompleted()).isTrue();

        AgentRun closed = fixture.reload(planning);
        assertThat(closed.status()).isEqualTo(AgentRunStatus.TIMED_OUT);
        assertThat(closed.outcome()).isEqualTo("interrupted");
        assertThat(closed.completedAt()).isEqualTo(fixture.time.instant());

        assertThat(fixture.phases.findActiveByTask("task-1")).isEmpty();
        assertThat(fixture.phases.findByTaskAndPhase("task-1", "plan").orElseThrow().status())
            .isEqualTo(PhaseStatus.FAILED);
        assertThat(fixture.prompts.findById(prompt.id()).orElseThrow().status()).isEqualTo(PromptStatus.EXPIRED);

        verify(fixture.workspaceProvider).unlock("task-1");
        verify(fixture.workspaceProvider).unlock("task-2");
        assertThat(fixture.warningsOf("task-1"))
            .extracting(e -> e.message())
            .containsExactly("Agent run interrupted by restart");
        assertThat(fixture.meterRegistry.counter(AgentFlowMetrics.RECOVERED_RUNS).count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Finished runs are left untouched")
    void leavesTerminalRunsAlone() {
        AgentRun run = fixture.runningRun("task-1", "scripted", "plan");
        fixture.runTerminator.terminate(run, AgentRunStatus.CANCELLED, null, "Agent stopped");

        List<InterruptedRun> interrupted = recovery.recover();

        assertThat(interrupted).isEmpty();
        assertThat(fixture.reload(run).status()).isEqualTo(AgentRunStatus.CANCELLED);
        assertThat(recovery.isCompleted()).isTrue();
    }

    @Test
    @DisplayName("Recovery runs only once per process")
    void runsOnce() {
        fixture.runningRun("task-1", "scripted", "plan");
        recovery.recover();

        assertThatThrownBy(() -> recovery.recover())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already ran");
    }

    @Test
    @DisplayName("An unlock failure is reported and does not stop recovery")
    void unlockFailureDoesNotStopRecovery() {
        AgentRun first = fixture.runningRun("task-1", "scripted", "plan");
        AgentRun second = fixture.runningRun("task-2", "scripted", "plan");
        doThrow(new IllegalStateException("worktree missing")).when(fixture.workspaceProvider).unlock("task-1");

        List<InterruptedRun> interrupted = recovery.recover();

        assertThat(interrupted).hasSize(2);
        assertThat(fixture.reload(first).status()).isEqualTo(AgentRunStatus.TIMED_OUT);
        assertThat(fixture.reload(second).status()).isEqualTo(AgentRunStatus.TIMED_OUT);
        assertThat(fixture.warningsOf("task-1"))
            .extracting(e -> e.message())
            .contains("Failed to unlock workspace: worktree missing");
        verify(fixture.workspaceProvider, times(1)).unlock("task-2");
    }
}
