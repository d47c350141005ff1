package com.agentflow.engine.coordinator;

import com.agentflow.core.exception.AgentAlreadyRunningException;
import com.agentflow.core.exception.AgentExecutionException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.WorkspaceException;
import com.agentflow.core.model.*;
import com.agentflow.core.repository.*;
import com.agentflow.core.spi.AgentCapability;
import com.agentflow.core.spi.AgentConfig;
import com.agentflow.core.spi.AgentContext;
import com.agentflow.core.spi.AgentResult;
import com.agentflow.core.spi.Workspace;
import com.agentflow.core.spi.WorkspaceProvider;
import com.agentflow.engine.agent.AgentCapabilityRegistry;
import com.agentflow.engine.agent.AgentRuntimeSettings;
import com.agentflow.engine.agent.ArtifactCollector;
import com.agentflow.engine.agent.ArtifactCollector.CollectedArtifacts;
import com.agentflow.engine.agent.OutputBuffer;
import com.agentflow.engine.agent.PlanExtractor;
import com.agentflow.engine.agent.PlanExtractor.ExtractedPlan;
import com.agentflow.engine.agent.RunTerminator;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.logging.TaskEventRecorder;
import com.agentflow.engine.metrics.AgentFlowMetrics;
import com.agentflow.engine.outcome.OutcomeSchemaRegistry;
import com.agentflow.engine.outcome.PayloadValidation;
import com.agentflow.engine.service.AgentService;
import com.agentflow.engine.service.PipelineService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Agent execution service.
 *
 * {@link #execute} creates the run, activates the task phase and locks the
 * workspace, then hands the agent to a background worker and returns. The
 * background half persists the result, collects artifacts, releases the
 * workspace and routes the outcome back into the pipeline engine.
 */
public class AgentCoordinator implements AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentCoordinator.class);

    private final TaskRepository taskRepository;
    private final ProjectRepository projectRepository;
    private final AgentRunRepository runRepository;
    private final TaskPhaseRepository phaseRepository;
    private final PendingPromptRepository promptRepository;
    private final AgentCapabilityRegistry capabilities;
    private final WorkspaceProvider workspaceProvider;
    private final PipelineService pipelineService;
    private final ArtifactCollector artifactCollector;
    private final RunTerminator runTerminator;
    private final PlanExtractor planExtractor;
    private final OutcomeSchemaRegistry outcomeSchemas;
    private final TransactionTemplate transactionTemplate;
    private final TaskEventRecorder recorder;
    private final AgentFlowMetrics metrics;
    private final ObjectMapper objectMapper;
    private final AgentRuntimeSettings settings;
    private final Clock clock;

    private final ExecutorService workerPool;
    private final ScheduledExecutorService outputFlusher;
    private final Map<String, CompletableFuture<Void>> activeRuns = new ConcurrentHashMap<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private volatile BooleanSupplier admission = () -> true;

    public AgentCoordinator(
            TaskRepository taskRepository,
            ProjectRepository projectRepository,
            AgentRunRepository runRepository,
            TaskPhaseRepository phaseRepository,
            PendingPromptRepository promptRepository,
            AgentCapabilityRegistry capabilities,
            WorkspaceProvider workspaceProvider,
            PipelineService pipelineService,
            ArtifactCollector artifactCollector,
            RunTerminator runTerminator,
            OutcomeSchemaRegistry outcomeSchemas,
            TransactionTemplate transactionTemplate,
            TaskEventRecorder recorder,
            AgentFlowMetrics metrics,
            ObjectMapper objectMapper,
            AgentRuntimeSettings settings,
            Clock clock) {
        this.taskRepository = taskRepository;
        this.projectRepository = projectRepository;
        this.runRepository = runRepository;
        this.phaseRepository = phaseRepository;
        this.promptRepository = promptRepository;
        this.capabilities = capabilities;
        this.workspaceProvider = workspaceProvider;
        this.pipelineService = pipelineService;
        this.artifactCollector = artifactCollector;
        this.runTerminator = runTerminator;
        this.planExtractor = new PlanExtractor(objectMapper);
        this.outcomeSchemas = outcomeSchemas;
        this.transactionTemplate = transactionTemplate;
        this.recorder = recorder;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.clock = clock;
        this.workerPool = Executors.newCachedThreadPool(namedThreads("agent-run-"));
        this.outputFlusher = Executors.newSingleThreadScheduledExecutor(namedThreads("agent-output-"));
    }

    /**
     * Gate consulted before every run. The application closes it until startup recovery has
     * reconciled the previous process's runs.
     */
    public void setAdmission(BooleanSupplier admission) {
        this.admission = admission;
    }

    @Override
    public AgentRun execute(String taskId, String mode, String agentType, Consumer<String> onOutput) {
        if (shuttingDown.get()) {
            throw new AgentExecutionException("Agent service is shutting down");
        }
        if (!admission.getAsBoolean()) {
            throw new AgentExecutionException("Agent runs are not accepted until startup recovery completes");
        }
        Task task = taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));
        Project project = projectRepository.findById(task.projectId())
            .orElseThrow(() -> new NotFoundException("Project", task.projectId()));
        AgentCapability capability = capabilities.get(agentType);

        // Run creation and phase activation are serialized on the task row
        AgentRun run = transactionTemplate.execute(status -> startRun(task, mode, agentType));

        // Active from here on, so the supervisor does not mistake a run in setup for a ghost
        CompletableFuture<Void> done = new CompletableFuture<>();
        activeRuns.put(run.id(), done);

        try (LoggingContext lc = LoggingContext.forRun(taskId, run.id())) {
            Workspace workspace;
            try {
                workspace = prepareWorkspace(task, mode);
            } catch (WorkspaceException e) {
                deregister(run.id(), done);
                log.error("Workspace preparation failed for run {}: {}", run.id(), e.getMessage());
                runTerminator.terminate(run, AgentRunStatus.FAILED, OutcomeSchemaRegistry.FAILED,
                    "Workspace preparation failed: " + e.getMessage());
                throw e;
            }

            AgentRun current = getRun(run.id());
            if (current.isTerminal()) {
                log.info("Run {} became {} during workspace setup, not launching", run.id(), current.status().value());
                releaseIfIdle(taskId);
                deregister(run.id(), done);
                return current;
            }

            recorder.info(taskId, EventCategory.AGENT, "Agent " + agentType + " started in " + mode + " mode",
                TaskEventRecorder.data(
                    "agentRunId", run.id(),
                    "agentType", agentType,
                    "mode", mode,
                    "branch", workspace.branch()));
            log.info("Started {} run {} in {} mode on {}", agentType, run.id(), mode, workspace.branch());

            metrics.runStarted(agentType);
            launch(run, task, project, workspace, capability, onOutput, done);
            return run;
        }
    }

    @Override
    public void waitForCompletion(String runId) {
        CompletableFuture<Void> done = activeRuns.get(runId);
        if (done != null) {
            done.join();
        }
    }

    @Override
    public boolean waitForCompletion(String runId, Duration timeout) throws InterruptedException {
        CompletableFuture<Void> done = activeRuns.get(runId);
        if (done == null) {
            return true;
        }
        try {
            done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Background run " + runId + " completed exceptionally", e.getCause());
        }
    }

    @Override
    public void stop(String runId) {
        terminate(runId, AgentRunStatus.CANCELLED, null, "Agent run cancelled");
    }

    @Override
    public boolean terminate(String runId, AgentRunStatus status, String outcome, String reason) {
        AgentRun run = getRun(runId);
        if (run.isTerminal()) {
            log.debug("Run {} is already {}", runId, run.status().value());
            return false;
        }

        try (LoggingContext lc = LoggingContext.forRun(run.taskId(), runId)) {
            // Cooperative: the run record becomes terminal whether or not the agent acknowledges
            try {
                capabilities.get(run.agentType()).stop(runId);
            } catch (RuntimeException e) {
                log.warn("Agent {} did not accept stop for run {}: {}", run.agentType(), runId, e.getMessage());
            }
            return runTerminator.terminate(run, status, outcome, reason);
        }
    }

    @Override
    public AgentRun getRun(String runId) {
        return runRepository.findById(runId)
            .orElseThrow(() -> new NotFoundException("AgentRun", runId));
    }

    @Override
    public List<AgentRun> getRunsForTask(String taskId) {
        return runRepository.findByTask(taskId);
    }

    @Override
    public Set<String> getActiveRunIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    @Override
    public boolean isActive(String runId) {
        return activeRuns.containsKey(runId);
    }

    @Override
    public void shutdown(Duration timeout) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down agent service, {} run(s) active", activeRuns.size());
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} run(s) still active after {}; they will be recovered on next start",
                    activeRuns.size(), timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        outputFlusher.shutdownNow();
    }

    // ========== Run Setup ==========

    private AgentRun startRun(Task task, String mode, String agentType) {
        if (!taskRepository.lockForUpdate(task.id())) {
            throw new NotFoundException("Task", task.id());
        }
        Optional<TaskPhase> active = phaseRepository.findActiveByTask(task.id());
        if (active.isPresent()) {
            throw new AgentAlreadyRunningException(task.id(), active.get().phase(), active.get().agentRunId());
        }

        Instant now = clock.instant();
        AgentRun run = AgentRun.start(task.id(), agentType, mode, now);
        runRepository.save(run);

        Optional<TaskPhase> existing = phaseRepository.findByTaskAndPhase(task.id(), mode);
        if (existing.isPresent()) {
            phaseRepository.activate(existing.get().id(), run.id(), now);
        } else {
            phaseRepository.save(TaskPhase.activate(task.id(), mode, run.id(), now));
        }
        return run;
    }

    private Workspace prepareWorkspace(Task task, String mode) {
        try {
            Optional<Workspace> existing = workspaceProvider.get(task.id());
            Workspace workspace;
            if (existing.isPresent()) {
                workspace = existing.get();
            } else {
                workspace = workspaceProvider.create(settings.branchFor(task.id(), mode), task.id());
                recorder.info(task.id(), EventCategory.WORKSPACE, "Workspace created on " + workspace.branch(),
                    TaskEventRecorder.data("path", workspace.path(), "branch", workspace.branch()));
            }
            workspaceProvider.lock(task.id());
            return workspace;
        } catch (WorkspaceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WorkspaceException("Failed to prepare workspace for task " + task.id() + ": " + e.getMessage(), e);
        }
    }

    private void launch(
            AgentRun run, Task task, Project project, Workspace workspace,
            AgentCapability capability, Consumer<String> onOutput, CompletableFuture<Void> done) {
        Map<String, String> mdc = LoggingContext.capture();

        try {
            workerPool.execute(() -> {
                try (LoggingContext lc = LoggingContext.restore(mdc)) {
                    runInBackground(run, task, project, workspace, capability, onOutput);
                } finally {
                    metrics.backgroundRunExited();
                    deregister(run.id(), done);
                }
            });
        } catch (RejectedExecutionException e) {
            metrics.backgroundRunExited();
            deregister(run.id(), done);
            runTerminator.terminate(run, AgentRunStatus.FAILED, OutcomeSchemaRegistry.FAILED,
                "Agent run could not be scheduled");
            throw new AgentExecutionException("Agent worker pool rejected run " + run.id(), e);
        }
    }

    private void deregister(String runId, CompletableFuture<Void> done) {
        activeRuns.remove(runId);
        done.complete(null);
    }

    /**
     * Unlocks the task's workspace unless another run of the task already holds it.
     */
    private void releaseIfIdle(String taskId) {
        if (phaseRepository.findActiveByTask(taskId).isEmpty()) {
            runTerminator.releaseWorkspace(taskId);
        }
    }

    // ========== Background Execution ==========

    private void runInBackground(
            AgentRun run, Task task, Project project, Workspace workspace,
            AgentCapability capability, Consumer<String> onOutput) {
        if (getRun(run.id()).isTerminal()) {
            log.info("Run {} was terminated before the agent started", run.id());
            return;
        }
        OutputBuffer buffer = new OutputBuffer();
        long flushMillis = settings.outputFlushInterval().toMillis();
        ScheduledFuture<?> flusher = outputFlusher.scheduleAtFixedRate(
            () -> flushOutput(run.id(), buffer), flushMillis, flushMillis, TimeUnit.MILLISECONDS);

        try {
            AgentResult result;
            try {
                result = capability.execute(
                    new AgentContext(run.id(), task, project, workspace.path(), run.mode()),
                    new AgentConfig(project.configuredModel(), settings.timeoutFor(run.agentType())),
                    chunk -> {
                        buffer.append(chunk);
                        forward(onOutput, chunk);
                    });
            } catch (RuntimeException e) {
                flusher.cancel(false);
                log.error("Agent {} threw during run {}", run.agentType(), run.id(), e);
                handleFailure(run, buffer.contents(), null, errorMessage(e), null, null);
                return;
            }
            flusher.cancel(false);

            if (result == null) {
                handleFailure(run, buffer.contents(), null, "Agent returned no result", null, null);
            } else {
                String output = result.output() != null ? result.output() : buffer.contents();
                if (result.isSuccess()) {
                    handleSuccess(run, task, workspace, result, output);
                } else {
                    handleFailure(run, output, result.exitCode(), result.error(),
                        result.costInputTokens(), result.costOutputTokens());
                }
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error while finishing run {}", run.id(), e);
            runTerminator.terminate(run, AgentRunStatus.FAILED, OutcomeSchemaRegistry.FAILED,
                "Agent run failed unexpectedly: " + errorMessage(e));
        } finally {
            flusher.cancel(false);
        }
    }

    private void handleFailure(AgentRun run, String output, Integer exitCode, String error, Long inputTokens, Long outputTokens) {
        AgentRun terminal = run.withTerminal(AgentRunStatus.FAILED, output, OutcomeSchemaRegistry.FAILED, null,
            exitCode, inputTokens, outputTokens, clock.instant());
        if (!runTerminator.finish(terminal, PhaseStatus.FAILED)) {
            log.info("Run {} was already terminated, discarding failure result", run.id());
            return;
        }
        runTerminator.releaseWorkspace(run.taskId());

        String reason = error != null ? error : "exit code " + exitCode;
        log.error("Agent {} failed on task {}: {}", run.agentType(), run.taskId(), reason);
        recorder.error(run.taskId(), EventCategory.AGENT, "Agent " + run.agentType() + " failed: " + reason,
            TaskEventRecorder.data(
                "agentRunId", run.id(),
                "mode", run.mode(),
                "exitCode", exitCode));
        // The task stays in its status; retries are bounded by max_retries
    }

    private void handleSuccess(AgentRun run, Task task, Workspace workspace, AgentResult result, String output) {
        String outcome = result.outcome();
        AgentRun terminal = run.withTerminal(AgentRunStatus.COMPLETED, output, outcome, result.payload(), 0,
            result.costInputTokens(), result.costOutputTokens(), clock.instant());
        if (!runTerminator.finish(terminal, PhaseStatus.COMPLETED)) {
            log.info("Run {} was already terminated, discarding result with outcome {}", run.id(), outcome);
            return;
        }

        if (outcome != null) {
            PayloadValidation validation = outcomeSchemas.validate(outcome, result.payload());
            if (!validation.valid()) {
                log.warn("Run {} reported outcome {} with invalid payload: {}", run.id(), outcome, validation.error());
                recorder.warning(task.id(), EventCategory.AGENT, "Invalid outcome payload: " + validation.error(),
                    TaskEventRecorder.data("outcome", outcome, "error", validation.error()));
            }
        }

        if (PlanExtractor.isPlanMode(run.mode())) {
            applyPlan(task.id(), result.payload(), output);
        }

        CollectedArtifacts artifacts = artifactCollector.collect(task, terminal, workspace, outcome);

        // Released before the follow-up transition so a chained start_agent can lock it again
        runTerminator.releaseWorkspace(task.id());

        recorder.info(task.id(), EventCategory.AGENT,
            "Agent " + run.agentType() + " completed with outcome: " + outcome,
            TaskEventRecorder.data(
                "agentRunId", run.id(),
                "mode", run.mode(),
                "outcome", outcome,
                "costInputTokens", result.costInputTokens(),
                "costOutputTokens", result.costOutputTokens()));
        log.info("Run {} completed with outcome {}", run.id(), outcome);

        if (outcome == null) {
            return;
        }
        if (OutcomeSchemaRegistry.NEEDS_INFO.equals(outcome)) {
            createPrompt(task.id(), run, result.payload());
        }
        if (artifacts.emptyDiff()) {
            return;
        }
        tryOutcomeTransition(task.id(), run, outcome, result.payload(), workspace);
    }

    private void applyPlan(String taskId, JsonNode payload, String output) {
        try {
            Optional<ExtractedPlan> extracted = planExtractor.extract(payload, output);
            Optional<Task> current = taskRepository.findById(taskId);
            if (extracted.isEmpty() || current.isEmpty()) {
                return;
            }
            List<Subtask> subtasks = extracted.get().subtasks().isEmpty()
                ? current.get().subtasks()
                : extracted.get().subtasks();
            taskRepository.updatePlan(taskId, extracted.get().plan(), subtasks, clock.instant());
            recorder.debug(taskId, EventCategory.AGENT, "Plan updated",
                TaskEventRecorder.data("subtaskCount", subtasks.size()));
        } catch (RuntimeException e) {
            log.warn("Plan extraction failed for task {}: {}", taskId, e.getMessage());
            recorder.warning(taskId, EventCategory.AGENT, "Failed to update plan: " + e.getMessage(), null);
        }
    }

    private void createPrompt(String taskId, AgentRun run, JsonNode runPayload) {
        Optional<Task> current = taskRepository.findById(taskId);
        if (current.isEmpty()) {
            return;
        }
        ObjectNode payload = runPayload != null && runPayload.isObject()
            ? runPayload.deepCopy()
            : objectMapper.createObjectNode();
        payload.put(PendingPrompt.RESUME_TO_STATUS, current.get().status());

        PendingPrompt prompt = PendingPrompt.open(taskId, run.id(), OutcomeSchemaRegistry.NEEDS_INFO, payload,
            PendingPrompt.DEFAULT_RESUME_OUTCOME, clock.instant());
        promptRepository.save(prompt);
        recorder.info(taskId, EventCategory.PROMPT, "Agent is waiting for input",
            TaskEventRecorder.data("promptId", prompt.id(), "agentRunId", run.id()));
        log.info("Created prompt {} for run {}", prompt.id(), run.id());
    }

    /**
     * Follow the first agent transition from the current status keyed on the outcome.
     */
    private void tryOutcomeTransition(String taskId, AgentRun run, String outcome, JsonNode payload, Workspace workspace) {
        Optional<Task> current = taskRepository.findById(taskId);
        if (current.isEmpty()) {
            return;
        }
        Optional<Transition> match = pipelineService.getValidTransitions(current.get(), TransitionTrigger.AGENT)
            .stream()
            .filter(t -> outcome.equals(t.agentOutcome()))
            .findFirst();
        if (match.isEmpty()) {
            log.info("No transition from {} for outcome {}", current.get().status(), outcome);
            return;
        }

        ObjectNode data = objectMapper.createObjectNode();
        data.put("outcome", outcome);
        data.put("agentRunId", run.id());
        if (payload != null) {
            data.set("payload", payload);
        }
        data.put("branch", workspace.branch());

        TransitionResult result = pipelineService.executeTransition(
            current.get(), match.get().to(), TransitionContext.agent(run.id(), data));
        if (!result.success()) {
            log.warn("Outcome transition {} -> {} failed: {}", current.get().status(), match.get().to(), result.error());
            recorder.warning(taskId, EventCategory.AGENT, "Outcome transition failed: " + result.error(),
                TaskEventRecorder.data(
                    "outcome", outcome,
                    "toStatus", match.get().to(),
                    "errorCode", result.errorCode() != null ? result.errorCode().name() : null));
        }
    }

    private void flushOutput(String runId, OutputBuffer buffer) {
        String output = buffer.takeIfDirty();
        if (output == null) {
            return;
        }
        try {
            runRepository.updateOutput(runId, output);
        } catch (RuntimeException e) {
            log.warn("Failed to flush output of run {}: {}", runId, e.getMessage());
        }
    }

    private static void forward(Consumer<String> onOutput, String chunk) {
        if (onOutput == null) {
            return;
        }
        try {
            onOutput.accept(chunk);
        } catch (RuntimeException e) {
            log.warn("Output consumer failed: {}", e.getMessage());
        }
    }

    private static String errorMessage(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
