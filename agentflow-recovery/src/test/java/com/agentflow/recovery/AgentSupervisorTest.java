package com.agentflow.recovery;

import com.agentflow.core.model.AgentRun;
import com.agentflow.core.model.AgentRunStatus;
import com.agentflow.engine.agent.AgentRuntimeSettings;
import com.agentflow.engine.metrics.AgentFlowMetrics;
import com.agentflow.engine.service.AgentService;
import com.agentflow.recovery.support.RecoveryFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Agent supervisor")
class AgentSupervisorTest {

    private RecoveryFixture fixture;
    private AgentService agentService;
    private StartupRecovery recovery;
    private AgentSupervisor supervisor;

    @BeforeEach
    void setUp() {
        fixture = new RecoveryFixture();
        agentService = mock(AgentService.class);
        when(agentService.terminate(anyString(), any(), any(), anyString())).thenAnswer(inv -> {
            AgentRun run = fixture.runs.findById(inv.getArgument(0)).orElseThrow();
            return fixture.runTerminator.terminate(run, inv.getArgument(1), inv.getArgument(2), inv.getArgument(3));
        });

        AgentRuntimeSettings runtime = new AgentRuntimeSettings(null, null, null, Duration.ofMinutes(15),
            Map.of("slow-agent", Duration.ofMinutes(45)));
        recovery = new StartupRecovery(fixture.runs, fixture.runTerminator, fixture.metrics);
        supervisor = new AgentSupervisor(fixture.runs, agentService, recovery, runtime,
            new SupervisorSettings(Duration.ofMinutes(10), Duration.ofSeconds(60)), fixture.metrics, fixture.time);
    }

    @AfterEach
    void tearDown() {
        supervisor.stop();
        fixture.close();
    }

    private void markActive(AgentRun run) {
        when(agentService.isActive(run.id())).thenReturn(true);
    }

    @Nested
    @DisplayName("Timeouts")
    class Timeouts {

        @Test
        @DisplayName("A live run past its timeout is terminated")
        void terminatesOverdueRun() {
            AgentRun run = fixture.runningRun("task-1", "scripted", "implement");
            markActive(run);

            fixture.time.advanceMinutes(16);
            int terminated = supervisor.sweep();

            assertThat(terminated).isEqualTo(1);
            AgentRun closed = fixture.reload(run);
            assertThat(closed.status()).isEqualTo(AgentRunStatus.TIMED_OUT);
            assertThat(closed.outcome()).isNull();
            assertThat(fixture.phases.findActiveByTask("task-1")).isEmpty();
            verify(fixture.workspaceProvider).unlock("task-1");
            assertThat(fixture.warningsOf("task-1"))
                .extracting(e -> e.message())
                .containsExactly("Agent run timed out after 15 minutes");
            assertThat(fixture.meterRegistry.counter(AgentFlowMetrics.SUPERVISOR_TIMEOUTS, "reason", "timeout").count())
                .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Runs within their timeout are left alone")
        void leavesRunsWithinLimits() {
            AgentRun run = fixture.runningRun("task-1", "scripted", "implement");
            markActive(run);

            fixture.time.advanceMinutes(14);

            assertThat(supervisor.sweep()).isZero();
            assertThat(fixture.reload(run).status()).isEqualTo(AgentRunStatus.RUNNING);
            verify(agentService, never()).terminate(anyString(), any(), any(), anyString());
        }

        @Test
        @DisplayName("Per agent type timeouts override the default")
        void usesAgentTypeTimeout() {
            AgentRun slow = fixture.runningRun("task-1", "slow-agent", "implement");
            AgentRun fast = fixture.runningRun("task-2", "scripted", "implement");
            markActive(slow);
            markActive(fast);

            fixture.time.advanceMinutes(30);

            assertThat(supervisor.sweep()).isEqualTo(1);
            assertThat(fixture.reload(slow).status()).isEqualTo(AgentRunStatus.RUNNING);
            assertThat(fixture.reload(fast).status()).isEqualTo(AgentRunStatus.TIMED_OUT);
        }
    }

    @Nested
    @DisplayName("Ghost runs")
    class GhostRuns {

        @Test
        @DisplayName("A running run without a background worker is closed after the grace period")
        void closesGhostRun() {
            AgentRun run = fixture.runningRun("task-1", "scripted", "plan");

            fixture.time.advanceSeconds(61);

            assertThat(supervisor.sweep()).isEqualTo(1);
            AgentRun closed = fixture.reload(run);
            assertThat(closed.status()).isEqualTo(AgentRunStatus.TIMED_OUT);
            assertThat(closed.outcome()).isEqualTo("interrupted");
            assertThat(fixture.meterRegistry.counter(AgentFlowMetrics.SUPERVISOR_TIMEOUTS, "reason", "ghost").count())
                .isEqualTo(1.0);
        }

        @Test
        @DisplayName("A freshly started run is not treated as a ghost")
        void respectsGracePeriod() {
            AgentRun run = fixture.runningRun("task-1", "scripted", "plan");

            fixture.time.advanceSeconds(30);

            assertThat(supervisor.sweep()).isZero();
            assertThat(fixture.reload(run).status()).isEqualTo(AgentRunStatus.RUNNING);
        }

        @Test
        @DisplayName("A run finished concurrently is not counted")
        void ignoresRunFinishedMeanwhile() {
            AgentRun run = fixture.runningRun("task-1", "scripted", "plan");
            fixture.time.advanceSeconds(90);
            fixture.runTerminator.terminate(run, AgentRunStatus.CANCELLED, null, "Agent stopped");

            assertThat(supervisor.sweep()).isZero();
            assertThat(fixture.reload(run).status()).isEqualTo(AgentRunStatus.CANCELLED);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Cannot start before startup recovery completed")
        void requiresRecovery() {
            assertThatThrownBy(() -> supervisor.start())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Startup recovery");
            assertThat(supervisor.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Starts after recovery and reports its state")
        void startsAfterRecovery() {
            recovery.recover();

            supervisor.start();

            assertThat(supervisor.isRunning()).isTrue();
            supervisor.stop();
            assertThat(supervisor.isRunning()).isFalse();
        }

        @Test
        @DisplayName("A sweep records its time")
        void recordsSweepTime() {
            assertThat(supervisor.lastSweepAt()).isNull();

            supervisor.sweep();

            assertThat(supervisor.lastSweepAt()).isEqualTo(fixture.time.instant());
        }
    }
}
