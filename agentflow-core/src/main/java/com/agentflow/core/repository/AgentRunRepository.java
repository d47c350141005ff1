package com.agentflow.core.repository;

import com.agentflow.core.model.AgentRun;
import java.util.List;
import java.util.Optional;

/**
 * Repository for AgentRun persistence.
 * Terminal updates are conditional on the run still being running.
 */
public interface AgentRunRepository {

    /**
     * Store a new run.
     */
    void save(AgentRun run);

    Optional<AgentRun> findById(String id);

    List<AgentRun> findByTask(String taskId);

    /**
     * All runs currently in RUNNING state, oldest first.
     */
    List<AgentRun> findRunning();

    /**
     * Replace the output of a live run.
     *
     * @return false if the run is no longer running
     */
    boolean updateOutput(String id, String output);

    /**
     * Move a run to its terminal state.
     *
     * @param run The run carrying the terminal status and results
     * @return true if the run was still running and is now terminal
     */
    boolean complete(AgentRun run);

    /**
     * Count failed runs of a task in a given mode.
     */
    int countFailed(String taskId, String mode);
}
