package com.agentflow.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentRunTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertThat(AgentRunStatus.RUNNING.isTerminal()).isFalse();
        assertThat(AgentRunStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(AgentRunStatus.FAILED.isTerminal()).isTrue();
        assertThat(AgentRunStatus.TIMED_OUT.isTerminal()).isTrue();
        assertThat(AgentRunStatus.CANCELLED.isTerminal()).isTrue();
    }

    @Test
    void start_shouldCreateRunningRun() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        AgentRun run = AgentRun.start("t1", "scripted", "plan", now);

        assertThat(run.status()).isEqualTo(AgentRunStatus.RUNNING);
        assertThat(run.startedAt()).isEqualTo(now);
        assertThat(run.completedAt()).isNull();
    }

    @Test
    void withTerminal_shouldRejectRunning() {
        AgentRun run = AgentRun.start("t1", "scripted", "plan", Instant.now());

        assertThatThrownBy(() -> run.withTerminal(
                AgentRunStatus.RUNNING, null, null, null, null, null, null, Instant.now()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withTerminal_shouldKeepOutputWhenNoneGiven() {
        AgentRun run = AgentRun.start("t1", "scripted", "plan", Instant.now());

        AgentRun done = run.withTerminal(
            AgentRunStatus.CANCELLED, null, null, null, null, null, null, Instant.now());

        assertThat(done.output()).isEmpty();
        assertThat(done.isTerminal()).isTrue();
    }
}
