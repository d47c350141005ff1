package com.agentflow.engine.support;

import com.agentflow.core.model.*;
import com.agentflow.core.spi.GitOperations;
import com.agentflow.core.spi.NotificationRouter;
import com.agentflow.core.spi.PullRequest;
import com.agentflow.core.spi.ScmPlatform;
import com.agentflow.core.spi.Workspace;
import com.agentflow.core.spi.WorkspaceProvider;
import com.agentflow.engine.agent.AgentCapabilityRegistry;
import com.agentflow.engine.agent.AgentRuntimeSettings;
import com.agentflow.engine.agent.ArtifactCollector;
import com.agentflow.engine.agent.RunTerminator;
import com.agentflow.engine.agent.ScriptedAgentCapability;
import com.agentflow.engine.coordinator.AgentCoordinator;
import com.agentflow.engine.coordinator.PipelineCoordinator;
import com.agentflow.engine.coordinator.PromptCoordinator;
import com.agentflow.engine.coordinator.TaskCoordinator;
import com.agentflow.engine.guard.CoreGuards;
import com.agentflow.engine.guard.GuardRegistry;
import com.agentflow.engine.hook.HookRegistry;
import com.agentflow.engine.hook.LogActivityHook;
import com.agentflow.engine.hook.MergePrHook;
import com.agentflow.engine.hook.NotifyHook;
import com.agentflow.engine.hook.StartAgentHook;
import com.agentflow.engine.logging.TaskEventRecorder;
import com.agentflow.engine.metrics.AgentFlowMetrics;
import com.agentflow.engine.outcome.OutcomeSchemaRegistry;
import com.agentflow.engine.persistence.jdbc.*;
import com.agentflow.engine.pipeline.PipelineValidator;
import com.agentflow.engine.service.TaskService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Fully wired engine over a private in-memory H2 database, with mocked
 * workspace, git, SCM and notification collaborators.
 */
public class EngineFixture implements AutoCloseable {

    public static final String PR_URL = "https://github.com/acme/demo/pull/7";

    public final EmbeddedDatabase database;
    public final JdbcTemplate jdbcTemplate;
    public final TransactionTemplate transactionTemplate;
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final Clock clock;
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final AgentFlowMetrics metrics = new AgentFlowMetrics(meterRegistry);

    public final JdbcPipelineRepository pipelines;
    public final JdbcProjectRepository projects;
    public final JdbcTaskRepository tasks;
    public final JdbcTransitionHistoryRepository history;
    public final JdbcAgentRunRepository runs;
    public final JdbcTaskPhaseRepository phases;
    public final JdbcTaskArtifactRepository artifacts;
    public final JdbcPendingPromptRepository prompts;
    public final JdbcTaskEventLog events;
    public final JdbcActivityLog activity;
    public final TaskEventRecorder recorder;

    public final WorkspaceProvider workspaceProvider = mock(WorkspaceProvider.class);
    public final GitOperations git = mock(GitOperations.class);
    public final ScmPlatform scm = mock(ScmPlatform.class);
    public final NotificationRouter notifications = mock(NotificationRouter.class);

    public final GuardRegistry guardRegistry = new GuardRegistry();
    public final HookRegistry hookRegistry = new HookRegistry();
    public final OutcomeSchemaRegistry outcomeSchemas = OutcomeSchemaRegistry.defaults();
    public final AgentCapabilityRegistry capabilities = new AgentCapabilityRegistry();
    public final ScriptedAgentCapability scriptedAgent = new ScriptedAgentCapability(ScriptedAgentCapability::byMode);
    public final AgentRuntimeSettings settings;

    public final PipelineCoordinator pipelineService;
    public final RunTerminator runTerminator;
    public final AgentCoordinator agentService;
    public final TaskCoordinator taskService;
    public final PromptCoordinator promptService;

    public EngineFixture() {
        this(Clock.systemUTC());
    }

    public EngineFixture(Clock clock) {
        this.clock = clock;
        this.database = new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .setName("agentflow-" + UUID.randomUUID())
            .addScript("db/agentflow-schema.sql")
            .build();
        this.jdbcTemplate = new JdbcTemplate(database);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(database));

        this.pipelines = new JdbcPipelineRepository(jdbcTemplate, objectMapper, clock);
        this.projects = new JdbcProjectRepository(jdbcTemplate, objectMapper);
        this.tasks = new JdbcTaskRepository(jdbcTemplate, objectMapper);
        this.history = new JdbcTransitionHistoryRepository(jdbcTemplate, objectMapper);
        this.runs = new JdbcAgentRunRepository(jdbcTemplate, objectMapper);
        this.phases = new JdbcTaskPhaseRepository(jdbcTemplate, objectMapper);
        this.artifacts = new JdbcTaskArtifactRepository(jdbcTemplate, objectMapper);
        this.prompts = new JdbcPendingPromptRepository(jdbcTemplate, objectMapper);
        this.events = new JdbcTaskEventLog(jdbcTemplate, objectMapper);
        this.activity = new JdbcActivityLog(jdbcTemplate, objectMapper);
        this.recorder = new TaskEventRecorder(events, activity, objectMapper, clock);

        when(workspaceProvider.create(anyString(), anyString()))
            .thenAnswer(inv -> new Workspace("/tmp/worktrees/" + inv.getArgument(1), inv.getArgument(0)));
        when(git.diff(anyString(), anyString())).thenReturn("diff --git a/Login.java b/Login.java");
        when(scm.createPullRequest(any())).thenReturn(new PullRequest(PR_URL, 7));

        this.settings = new AgentRuntimeSettings(Duration.ofMillis(50), "task/", "main", null, Map.of());
        capabilities.register(scriptedAgent);

        new CoreGuards(tasks, pipelines, phases, runs).registerAll(guardRegistry);
        hookRegistry.register(HookKind.NOTIFY, new NotifyHook(notifications, "desktop"))
            .register(HookKind.LOG_ACTIVITY, new LogActivityHook(recorder))
            .register(HookKind.MERGE_PR, new MergePrHook(artifacts, scm, recorder));

        this.pipelineService = new PipelineCoordinator(pipelines, tasks, history, guardRegistry, hookRegistry,
            new PipelineValidator(guardRegistry, hookRegistry), transactionTemplate, recorder, metrics, clock);
        this.runTerminator = new RunTerminator(runs, phases, prompts, workspaceProvider, transactionTemplate,
            recorder, metrics, clock);
        ArtifactCollector artifactCollector = new ArtifactCollector(artifacts, tasks, git, scm, recorder,
            objectMapper, settings, clock);
        this.agentService = new AgentCoordinator(tasks, projects, runs, phases, prompts, capabilities,
            workspaceProvider, pipelineService, artifactCollector, runTerminator, outcomeSchemas,
            transactionTemplate, recorder, metrics, objectMapper, settings, clock);
        hookRegistry.register(HookKind.START_AGENT, new StartAgentHook(agentService, recorder));

        this.taskService = new TaskCoordinator(projects, tasks, pipelines, phases, artifacts, events, recorder, clock);
        this.promptService = new PromptCoordinator(prompts, tasks, pipelineService, recorder, objectMapper, clock);
    }

    public Project createProject() {
        return taskService.createProject(new TaskService.NewProject("demo", "/tmp/demo", null));
    }

    public Task createTask(Pipeline pipeline) {
        pipelineService.savePipeline(pipeline);
        Project project = createProject();
        return taskService.createTask(new TaskService.NewTask(
            project.id(), pipeline.id(), "Add login page", "desc", 0, List.of(), null, null));
    }

    public Task reload(Task task) {
        return tasks.findById(task.id()).orElseThrow();
    }

    public List<TaskEvent> eventsOf(Task task, EventSeverity severity) {
        return events.findByTask(task.id()).stream().filter(e -> e.severity() == severity).toList();
    }

    @Override
    public void close() {
        agentService.shutdown(Duration.ofSeconds(5));
        database.shutdown();
    }
}
