package com.agentflow.engine.service;

import com.agentflow.core.model.AgentRun;
import com.agentflow.core.model.AgentRunStatus;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Launches agent runs in the background and feeds their outcomes back
 * into the pipeline engine.
 */
public interface AgentService {

    /**
     * Start an agent run. Returns as soon as the run, its phase and its
     * workspace are in place; the agent itself runs in the background.
     *
     * @param taskId    The task to work on
     * @param mode      Phase name, e.g. plan or implement
     * @param agentType Registered agent capability type
     * @param onOutput  Receives output chunks, may be null
     * @return The run in RUNNING state
     * @throws com.agentflow.core.exception.NotFoundException if the task or project is missing
     * @throws com.agentflow.core.exception.AgentAlreadyRunningException if the task has an active phase
     * @throws com.agentflow.core.exception.WorkspaceException if the workspace cannot be prepared
     */
    AgentRun execute(String taskId, String mode, String agentType, Consumer<String> onOutput);

    /**
     * Block until the background work of a run has finished. Returns
     * immediately for runs that are not active in this process.
     */
    void waitForCompletion(String runId);

    /**
     * Bounded variant of {@link #waitForCompletion(String)}.
     *
     * @return true if the run finished within the timeout
     */
    boolean waitForCompletion(String runId, Duration timeout) throws InterruptedException;

    /**
     * Cancel a run. The run record becomes terminal even if the agent has not yet stopped.
     */
    void stop(String runId);

    /**
     * Force a running run into a terminal state, releasing its phase, prompts and workspace lock.
     *
     * @return true if this call moved the run out of RUNNING
     */
    boolean terminate(String runId, AgentRunStatus status, String outcome, String reason);

    AgentRun getRun(String runId);

    List<AgentRun> getRunsForTask(String taskId);

    /**
     * Runs whose background work is live in this process.
     */
    Set<String> getActiveRunIds();

    boolean isActive(String runId);

    /**
     * Stop accepting runs and wait a bounded time for live ones.
     */
    void shutdown(Duration timeout);
}
