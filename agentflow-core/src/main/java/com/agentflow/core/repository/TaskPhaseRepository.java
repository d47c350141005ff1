package com.agentflow.core.repository;

import com.agentflow.core.model.PhaseStatus;
import com.agentflow.core.model.TaskPhase;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for TaskPhase persistence.
 * The active phase is the per-task concurrency anchor.
 */
public interface TaskPhaseRepository {

    void save(TaskPhase phase);

    /**
     * Re-activate an existing phase row for a new run.
     */
    void activate(String phaseId, String agentRunId, Instant now);

    Optional<TaskPhase> findActiveByTask(String taskId);

    Optional<TaskPhase> findByTaskAndPhase(String taskId, String phase);

    /**
     * Most recently started phase of a task.
     */
    Optional<TaskPhase> findLatestByTask(String taskId);

    List<TaskPhase> findByTask(String taskId);

    /**
     * Finish the active phase bound to a run.
     *
     * @return true if an active phase was finished
     */
    boolean finishByRun(String agentRunId, PhaseStatus status, Instant now);
}
