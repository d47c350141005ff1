package com.agentflow.recovery.support;

import com.agentflow.core.model.*;
import com.agentflow.core.spi.WorkspaceProvider;
import com.agentflow.engine.agent.RunTerminator;
import com.agentflow.engine.logging.TaskEventRecorder;
import com.agentflow.engine.metrics.AgentFlowMetrics;
import com.agentflow.engine.persistence.jdbc.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.mock;

/**
 * Run persistence over a private in-memory H2 database with a controllable
 * clock and a mocked workspace provider.
 */
public class RecoveryFixture implements AutoCloseable {

    public static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    public final TimeController time = TimeController.frozenAt(START);
    public final EmbeddedDatabase database;
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final AgentFlowMetrics metrics = new AgentFlowMetrics(meterRegistry);

    public final JdbcAgentRunRepository runs;
    public final JdbcTaskPhaseRepository phases;
    public final JdbcPendingPromptRepository prompts;
    public final JdbcTaskEventLog events;
    public final JdbcActivityLog activity;
    public final WorkspaceProvider workspaceProvider = mock(WorkspaceProvider.class);
    public final RunTerminator runTerminator;

    public RecoveryFixture() {
        this.database = new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .setName("agentflow-recovery-" + UUID.randomUUID())
            .addScript("db/agentflow-schema.sql")
            .build();
        JdbcTemplate jdbcTemplate = new JdbcTemplate(database);
        TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(database));

        this.runs = new JdbcAgentRunRepository(jdbcTemplate, objectMapper);
        this.phases = new JdbcTaskPhaseRepository(jdbcTemplate, objectMapper);
        this.prompts = new JdbcPendingPromptRepository(jdbcTemplate, objectMapper);
        this.events = new JdbcTaskEventLog(jdbcTemplate, objectMapper);
        this.activity = new JdbcActivityLog(jdbcTemplate, objectMapper);
        TaskEventRecorder recorder = new TaskEventRecorder(events, activity, objectMapper, time);
        this.runTerminator = new RunTerminator(runs, phases, prompts, workspaceProvider, transactionTemplate,
            recorder, metrics, time);
    }

    /**
     * Persist a RUNNING run with its active phase, started at the current fixture time.
     */
    public AgentRun runningRun(String taskId, String agentType, String mode) {
        AgentRun run = AgentRun.start(taskId, agentType, mode, time.instant());
        runs.save(run);
        phases.save(TaskPhase.activate(taskId, mode, run.id(), time.instant()));
        return run;
    }

    public PendingPrompt openPrompt(AgentRun run) {
        PendingPrompt prompt = PendingPrompt.open(run.taskId(), run.id(), "needs_info",
            objectMapper.createObjectNode(), null, time.instant());
        prompts.save(prompt);
        return prompt;
    }

    public AgentRun reload(AgentRun run) {
        return runs.findById(run.id()).orElseThrow();
    }

    public List<TaskEvent> warningsOf(String taskId) {
        return events.findByTask(taskId).stream()
            .filter(e -> e.severity() == EventSeverity.WARNING)
            .toList();
    }

    @Override
    public void close() {
        database.shutdown();
    }
}
