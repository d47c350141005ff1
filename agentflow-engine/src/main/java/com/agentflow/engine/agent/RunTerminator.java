package com.agentflow.engine.agent;

import com.agentflow.core.model.AgentRun;
import com.agentflow.core.model.AgentRunStatus;
import com.agentflow.core.model.EventCategory;
import com.agentflow.core.model.EventSeverity;
import com.agentflow.core.model.PhaseStatus;
import com.agentflow.core.repository.AgentRunRepository;
import com.agentflow.core.repository.PendingPromptRepository;
import com.agentflow.core.repository.TaskPhaseRepository;
import com.agentflow.core.spi.WorkspaceProvider;
import com.agentflow.engine.logging.TaskEventRecorder;
import com.agentflow.engine.metrics.AgentFlowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Moves runs out of RUNNING and releases what they hold: the active phase,
 * pending prompts and the workspace lock.
 *
 * Every path that ends a run (normal completion, failure, stop, supervisor
 * timeout, startup recovery) goes through {@link #finish}. The terminal write
 * is conditional, so when two paths race only the first one releases anything.
 */
public class RunTerminator {

    private static final Logger log = LoggerFactory.getLogger(RunTerminator.class);

    private final AgentRunRepository runRepository;
    private final TaskPhaseRepository phaseRepository;
    private final PendingPromptRepository promptRepository;
    private final WorkspaceProvider workspaceProvider;
    private final TransactionTemplate transactionTemplate;
    private final TaskEventRecorder recorder;
    private final AgentFlowMetrics metrics;
    private final Clock clock;

    public RunTerminator(
            AgentRunRepository runRepository,
            TaskPhaseRepository phaseRepository,
            PendingPromptRepository promptRepository,
            WorkspaceProvider workspaceProvider,
            TransactionTemplate transactionTemplate,
            TaskEventRecorder recorder,
            AgentFlowMetrics metrics,
            Clock clock) {
        this.runRepository = runRepository;
        this.phaseRepository = phaseRepository;
        this.promptRepository = promptRepository;
        this.workspaceProvider = workspaceProvider;
        this.transactionTemplate = transactionTemplate;
        this.recorder = recorder;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Persist a terminal run and finish its phase in one transaction.
     * Prompts raised by a run that did not complete are expired.
     *
     * @param terminal the run carrying its terminal status and results
     * @return false if the run had already left RUNNING; nothing was changed
     */
    public boolean finish(AgentRun terminal, PhaseStatus phaseStatus) {
        Boolean changed = transactionTemplate.execute(status -> {
            if (!runRepository.complete(terminal)) {
                return false;
            }
            phaseRepository.finishByRun(terminal.id(), phaseStatus, terminal.completedAt());
            if (terminal.status() != AgentRunStatus.COMPLETED) {
                int expired = promptRepository.expireByRun(terminal.id());
                if (expired > 0) {
                    log.info("Expired {} pending prompt(s) of run {}", expired, terminal.id());
                }
            }
            return true;
        });
        if (Boolean.TRUE.equals(changed)) {
            metrics.runFinished(terminal.agentType(), terminal.status(),
                terminal.completedAt() != null ? Duration.between(terminal.startedAt(), terminal.completedAt()) : null);
            return true;
        }
        return false;
    }

    /**
     * Force a run into a terminal state from outside its background execution.
     *
     * @return true if this call ended the run
     */
    public boolean terminate(AgentRun run, AgentRunStatus status, String outcome, String reason) {
        AgentRun terminal = run.withTerminal(status, null, outcome, null, null,
            run.costInputTokens(), run.costOutputTokens(), clock.instant());
        if (!finish(terminal, PhaseStatus.FAILED)) {
            log.debug("Run {} already terminal, {} ignored", run.id(), status.value());
            return false;
        }

        releaseWorkspace(run.taskId());
        EventSeverity severity = status == AgentRunStatus.CANCELLED ? EventSeverity.INFO : EventSeverity.WARNING;
        recorder.record(run.taskId(), EventCategory.AGENT, severity, reason,
            TaskEventRecorder.data(
                "agentRunId", run.id(),
                "agentType", run.agentType(),
                "mode", run.mode(),
                "status", status.value(),
                "outcome", outcome));
        if (severity == EventSeverity.INFO) {
            log.info("Run {} of task {} {}: {}", run.id(), run.taskId(), status.value(), reason);
        } else {
            log.warn("Run {} of task {} terminated as {}: {}", run.id(), run.taskId(), status.value(), reason);
        }
        return true;
    }

    /**
     * Unlock the task's workspace. A failure is reported as a warning event.
     */
    public void releaseWorkspace(String taskId) {
        try {
            workspaceProvider.unlock(taskId);
        } catch (RuntimeException e) {
            log.warn("Failed to unlock workspace of task {}: {}", taskId, e.getMessage());
            recorder.warning(taskId, EventCategory.WORKSPACE, "Failed to unlock workspace: " + e.getMessage(), null);
        }
    }
}
