package com.agentflow.engine.health;

import com.agentflow.core.model.AgentRun;
import com.agentflow.engine.support.EngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AgentFlowHealthIndicatorTest {

    private EngineFixture fx;

    @Mock
    private ObjectProvider<SupervisorState> supervisorProvider;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    @DisplayName("Healthy without a supervisor and reports run counts")
    void upWithoutSupervisor() {
        fx.runs.save(AgentRun.start("t1", "scripted", "plan", Instant.now()));

        Health health = indicator().health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("database", "connected")
            .containsEntry("runningRuns", 1)
            .containsEntry("supervisor", "absent");
    }

    @Test
    @DisplayName("A stopped supervisor makes the service unhealthy")
    void downWhenSupervisorStopped() {
        SupervisorState supervisor = mock(SupervisorState.class);
        when(supervisor.isRunning()).thenReturn(false);
        when(supervisorProvider.getIfAvailable()).thenReturn(supervisor);

        Health health = indicator().health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("supervisor", "stopped");
    }

    @Test
    @DisplayName("An unreachable database is reported down")
    void downWhenDatabaseGone() {
        fx.database.shutdown();

        Health health = indicator().health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("database", "disconnected");
    }

    private AgentFlowHealthIndicator indicator() {
        return new AgentFlowHealthIndicator(fx.jdbcTemplate, fx.metrics, supervisorProvider);
    }
}
