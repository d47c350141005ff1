package com.agentflow.recovery;

import com.agentflow.core.model.AgentRun;
import com.agentflow.core.model.AgentRunStatus;
import com.agentflow.core.repository.AgentRunRepository;
import com.agentflow.engine.agent.RunTerminator;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.metrics.AgentFlowMetrics;
import com.agentflow.engine.outcome.OutcomeSchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Startup reconciliation of agent runs left RUNNING by a previous process.
 *
 * Responsibilities:
 * - Close every such run as TIMED_OUT with outcome "interrupted"
 * - Release its phase and workspace lock, expire its prompts
 * - Report the closed runs so a human can be told
 *
 * Runs once per process, before the supervisor's first sweep.
 */
public class StartupRecovery {

    private static final Logger log = LoggerFactory.getLogger(StartupRecovery.class);

    static final String REASON = "Agent run interrupted by restart";

    private final AgentRunRepository runRepository;
    private final RunTerminator runTerminator;
    private final AgentFlowMetrics metrics;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean completed = false;

    public StartupRecovery(AgentRunRepository runRepository, RunTerminator runTerminator, AgentFlowMetrics metrics) {
        this.runRepository = runRepository;
        this.runTerminator = runTerminator;
        this.metrics = metrics;
    }

    /**
     * @return the runs this call closed
     * @throws IllegalStateException if recovery already ran in this process
     */
    public List<InterruptedRun> recover() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Startup recovery already ran");
        }

        List<AgentRun> orphaned = runRepository.findRunning();
        if (orphaned.isEmpty()) {
            log.info("Startup recovery: no interrupted agent runs");
            completed = true;
            return List.of();
        }

        log.warn("Startup recovery: found {} agent run(s) left running", orphaned.size());
        List<InterruptedRun> interrupted = new ArrayList<>();
        for (AgentRun run : orphaned) {
            try (LoggingContext lc = LoggingContext.forRun(run.taskId(), run.id())) {
                if (runTerminator.terminate(run, AgentRunStatus.TIMED_OUT, OutcomeSchemaRegistry.INTERRUPTED, REASON)) {
                    interrupted.add(new InterruptedRun(run.id(), run.taskId(), run.agentType(), run.mode(), run.startedAt()));
                    metrics.runRecovered();
                }
            } catch (RuntimeException e) {
                log.error("Failed to recover run {} of task {}", run.id(), run.taskId(), e);
            }
        }

        completed = true;
        log.info("Startup recovery complete: {} run(s) interrupted", interrupted.size());
        return interrupted;
    }

    public boolean isCompleted() {
        return completed;
    }
}
