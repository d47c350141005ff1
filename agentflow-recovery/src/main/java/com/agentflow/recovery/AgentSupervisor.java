package com.agentflow.recovery;

import com.agentflow.core.model.AgentRun;
import com.agentflow.core.model.AgentRunStatus;
import com.agentflow.core.repository.AgentRunRepository;
import com.agentflow.engine.agent.AgentRuntimeSettings;
import com.agentflow.engine.health.SupervisorState;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.metrics.AgentFlowMetrics;
import com.agentflow.engine.outcome.OutcomeSchemaRegistry;
import com.agentflow.engine.service.AgentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-interval watchdog over RUNNING agent runs.
 *
 * Responsibilities:
 * - Time out runs older than their agent type's timeout
 * - Close ghost runs: RUNNING in the datastore with no live background worker
 *
 * Both end as TIMED_OUT through {@link AgentService#terminate}, which releases
 * the phase and the workspace lock.
 */
public class AgentSupervisor implements SupervisorState {

    private static final Logger log = LoggerFactory.getLogger(AgentSupervisor.class);

    private final AgentRunRepository runRepository;
    private final AgentService agentService;
    private final StartupRecovery startupRecovery;
    private final AgentRuntimeSettings runtimeSettings;
    private final SupervisorSettings settings;
    private final AgentFlowMetrics metrics;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;
    private volatile Instant lastSweepAt;

    public AgentSupervisor(
            AgentRunRepository runRepository,
            AgentService agentService,
            StartupRecovery startupRecovery,
            AgentRuntimeSettings runtimeSettings,
            SupervisorSettings settings,
            AgentFlowMetrics metrics,
            Clock clock) {
        this.runRepository = runRepository;
        this.agentService = agentService;
        this.startupRecovery = startupRecovery;
        this.runtimeSettings = runtimeSettings;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "agent-supervisor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start polling.
     *
     * @throws IllegalStateException if startup recovery has not completed
     */
    public synchronized void start() {
        if (!startupRecovery.isCompleted()) {
            throw new IllegalStateException("Startup recovery must complete before the supervisor starts");
        }
        if (running) {
            log.warn("Agent supervisor already running");
            return;
        }

        running = true;
        long pollMillis = settings.pollInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::safeSweep, pollMillis, pollMillis, TimeUnit.MILLISECONDS);
        log.info("Agent supervisor started, polling every {}", settings.pollInterval());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Agent supervisor stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public Instant lastSweepAt() {
        return lastSweepAt;
    }

    /**
     * One pass over the RUNNING runs.
     *
     * @return number of runs this pass terminated
     */
    public int sweep() {
        Instant now = clock.instant();
        lastSweepAt = now;
        List<AgentRun> runs = runRepository.findRunning();

        int terminated = 0;
        for (AgentRun run : runs) {
            try (LoggingContext lc = LoggingContext.forRun(run.taskId(), run.id())) {
                if (check(run, now)) {
                    terminated++;
                }
            } catch (RuntimeException e) {
                log.error("Supervisor failed to check run {}", run.id(), e);
            }
        }
        if (terminated > 0) {
            log.warn("Supervisor terminated {} of {} running agent run(s)", terminated, runs.size());
        }
        return terminated;
    }

    private boolean check(AgentRun run, Instant now) {
        Duration age = Duration.between(run.startedAt(), now);

        if (!agentService.isActive(run.id()) && age.compareTo(settings.ghostGracePeriod()) > 0) {
            log.warn("Run {} has no background worker after {}, closing it", run.id(), age);
            boolean ended = agentService.terminate(run.id(), AgentRunStatus.TIMED_OUT,
                OutcomeSchemaRegistry.INTERRUPTED, "Agent run lost its background worker");
            if (ended) {
                metrics.supervisorTimeout("ghost");
            }
            return ended;
        }

        Duration timeout = runtimeSettings.timeoutFor(run.agentType());
        if (age.compareTo(timeout) > 0) {
            log.warn("Run {} exceeded its {} timeout ({} elapsed)", run.id(), timeout, age);
            boolean ended = agentService.terminate(run.id(), AgentRunStatus.TIMED_OUT, null,
                "Agent run timed out after " + timeout.toMinutes() + " minutes");
            if (ended) {
                metrics.supervisorTimeout("timeout");
            }
            return ended;
        }
        return false;
    }

    private void safeSweep() {
        if (!running) {
            return;
        }
        try {
            sweep();
        } catch (Exception e) {
            log.error("Error in supervisor sweep", e);
        }
    }
}
