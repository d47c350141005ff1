package com.agentflow.api.config;

import com.agentflow.api.local.CommandRunner;
import com.agentflow.api.local.GhCliScmPlatform;
import com.agentflow.api.local.GitCliOperations;
import com.agentflow.api.local.GitWorktreeWorkspaceProvider;
import com.agentflow.api.local.LoggingNotificationRouter;
import com.agentflow.core.model.HookKind;
import com.agentflow.core.repository.*;
import com.agentflow.core.spi.ActivityLog;
import com.agentflow.core.spi.GitOperations;
import com.agentflow.core.spi.NotificationRouter;
import com.agentflow.core.spi.ScmPlatform;
import com.agentflow.core.spi.TaskEventLog;
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
import com.agentflow.engine.pipeline.PipelineValidator;
import com.agentflow.recovery.AgentSupervisor;
import com.agentflow.recovery.StartupRecovery;
import com.agentflow.recovery.SupervisorSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the pipeline engine, the agent execution service, recovery and
 * the local collaborators.
 */
@Configuration
@EnableConfigurationProperties(AgentFlowProperties.class)
public class AgentFlowConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TaskEventRecorder taskEventRecorder(TaskEventLog eventLog, ActivityLog activityLog,
                                               ObjectMapper objectMapper, Clock clock) {
        return new TaskEventRecorder(eventLog, activityLog, objectMapper, clock);
    }

    // ========== Local collaborators ==========

    @Bean
    public CommandRunner commandRunner(AgentFlowProperties properties) {
        return new CommandRunner(properties.getWorkspace().getCommandTimeout());
    }

    @Bean
    public WorkspaceProvider workspaceProvider(CommandRunner runner, AgentFlowProperties properties) {
        AgentFlowProperties.Workspace workspace = properties.getWorkspace();
        return new GitWorktreeWorkspaceProvider(runner, Path.of(workspace.getRepository()),
            Path.of(workspace.getRoot()), workspace.getBaseBranch());
    }

    @Bean
    public GitOperations gitOperations(CommandRunner runner) {
        return new GitCliOperations(runner);
    }

    @Bean
    public ScmPlatform scmPlatform(CommandRunner runner, AgentFlowProperties properties, ObjectMapper objectMapper) {
        return new GhCliScmPlatform(runner, Path.of(properties.getWorkspace().getRepository()), objectMapper);
    }

    @Bean
    public NotificationRouter notificationRouter() {
        return new LoggingNotificationRouter();
    }

    // ========== Pipeline engine ==========

    @Bean
    public GuardRegistry guardRegistry(TaskRepository tasks, PipelineRepository pipelines,
                                       TaskPhaseRepository phases, AgentRunRepository runs) {
        GuardRegistry registry = new GuardRegistry();
        new CoreGuards(tasks, pipelines, phases, runs).registerAll(registry);
        return registry;
    }

    /**
     * start_agent is added once the agent service exists, see {@link #agentCoordinator}.
     */
    @Bean
    public HookRegistry hookRegistry(NotificationRouter notifications, TaskArtifactRepository artifacts,
                                     ScmPlatform scm, TaskEventRecorder recorder, AgentFlowProperties properties) {
        return new HookRegistry()
            .register(HookKind.NOTIFY, new NotifyHook(notifications, properties.getNotifications().getChannel()))
            .register(HookKind.LOG_ACTIVITY, new LogActivityHook(recorder))
            .register(HookKind.MERGE_PR, new MergePrHook(artifacts, scm, recorder));
    }

    @Bean
    public PipelineValidator pipelineValidator(GuardRegistry guardRegistry, HookRegistry hookRegistry) {
        return new PipelineValidator(guardRegistry, hookRegistry);
    }

    @Bean
    public PipelineCoordinator pipelineCoordinator(
            PipelineRepository pipelines, TaskRepository tasks, TransitionHistoryRepository history,
            GuardRegistry guardRegistry, HookRegistry hookRegistry, PipelineValidator validator,
            TransactionTemplate transactionTemplate, TaskEventRecorder recorder,
            AgentFlowMetrics metrics, Clock clock) {
        return new PipelineCoordinator(pipelines, tasks, history, guardRegistry, hookRegistry, validator,
            transactionTemplate, recorder, metrics, clock);
    }

    @Bean
    public TaskCoordinator taskCoordinator(
            ProjectRepository projects, TaskRepository tasks, PipelineRepository pipelines,
            TaskPhaseRepository phases, TaskArtifactRepository artifacts, TaskEventLog events,
            TaskEventRecorder recorder, Clock clock) {
        return new TaskCoordinator(projects, tasks, pipelines, phases, artifacts, events, recorder, clock);
    }

    @Bean
    public PromptCoordinator promptCoordinator(
            PendingPromptRepository prompts, TaskRepository tasks, PipelineCoordinator pipelineCoordinator,
            TaskEventRecorder recorder, ObjectMapper objectMapper, Clock clock) {
        return new PromptCoordinator(prompts, tasks, pipelineCoordinator, recorder, objectMapper, clock);
    }

    // ========== Agent execution ==========

    @Bean
    public AgentRuntimeSettings agentRuntimeSettings(AgentFlowProperties properties) {
        return new AgentRuntimeSettings(
            properties.getAgents().getOutputFlushInterval(),
            properties.getWorkspace().getBranchPrefix(),
            properties.getWorkspace().getBaseBranch(),
            properties.getSupervisor().getDefaultRunTimeout(),
            properties.getSupervisor().getRunTimeouts());
    }

    @Bean
    public AgentCapabilityRegistry agentCapabilityRegistry() {
        return new AgentCapabilityRegistry()
            .register(new ScriptedAgentCapability(ScriptedAgentCapability::byMode));
    }

    @Bean
    public OutcomeSchemaRegistry outcomeSchemaRegistry() {
        return OutcomeSchemaRegistry.defaults();
    }

    @Bean
    public RunTerminator runTerminator(
            AgentRunRepository runs, TaskPhaseRepository phases, PendingPromptRepository prompts,
            WorkspaceProvider workspaceProvider, TransactionTemplate transactionTemplate,
            TaskEventRecorder recorder, AgentFlowMetrics metrics, Clock clock) {
        return new RunTerminator(runs, phases, prompts, workspaceProvider, transactionTemplate,
            recorder, metrics, clock);
    }

    @Bean
    public ArtifactCollector artifactCollector(
            TaskArtifactRepository artifacts, TaskRepository tasks, GitOperations git, ScmPlatform scm,
            TaskEventRecorder recorder, ObjectMapper objectMapper, AgentRuntimeSettings settings, Clock clock) {
        return new ArtifactCollector(artifacts, tasks, git, scm, recorder, objectMapper, settings, clock);
    }

    @Bean
    public AgentCoordinator agentCoordinator(
            TaskRepository tasks, ProjectRepository projects, AgentRunRepository runs,
            TaskPhaseRepository phases, PendingPromptRepository prompts,
            AgentCapabilityRegistry capabilities, WorkspaceProvider workspaceProvider,
            PipelineCoordinator pipelineCoordinator, ArtifactCollector artifactCollector,
            RunTerminator runTerminator, OutcomeSchemaRegistry outcomeSchemas,
            TransactionTemplate transactionTemplate, TaskEventRecorder recorder, AgentFlowMetrics metrics,
            ObjectMapper objectMapper, AgentRuntimeSettings settings, Clock clock,
            HookRegistry hookRegistry, StartupRecovery startupRecovery) {
        AgentCoordinator coordinator = new AgentCoordinator(tasks, projects, runs, phases, prompts, capabilities,
            workspaceProvider, pipelineCoordinator, artifactCollector, runTerminator, outcomeSchemas,
            transactionTemplate, recorder, metrics, objectMapper, settings, clock);
        hookRegistry.register(HookKind.START_AGENT, new StartAgentHook(coordinator, recorder));
        coordinator.setAdmission(startupRecovery::isCompleted);
        return coordinator;
    }

    // ========== Recovery ==========

    @Bean
    public StartupRecovery startupRecovery(AgentRunRepository runs, RunTerminator runTerminator,
                                           AgentFlowMetrics metrics) {
        return new StartupRecovery(runs, runTerminator, metrics);
    }

    @Bean
    public AgentSupervisor agentSupervisor(
            AgentRunRepository runs, AgentCoordinator agentCoordinator, StartupRecovery startupRecovery,
            AgentRuntimeSettings runtimeSettings, AgentFlowProperties properties,
            AgentFlowMetrics metrics, Clock clock) {
        SupervisorSettings settings = new SupervisorSettings(
            properties.getSupervisor().getPollInterval(),
            properties.getSupervisor().getGhostGracePeriod());
        return new AgentSupervisor(runs, agentCoordinator, startupRecovery, runtimeSettings, settings, metrics, clock);
    }
}
