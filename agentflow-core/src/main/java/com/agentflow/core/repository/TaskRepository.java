package com.agentflow.core.repository;

import com.agentflow.core.model.Subtask;
import com.agentflow.core.model.Task;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Task persistence.
 * There is deliberately no generic update: status changes only through
 * {@link #updateStatus}, which the pipeline engine alone calls.
 */
public interface TaskRepository {

    /**
     * Store a new task.
     *
     * @param task The task to insert
     */
    void save(Task task);

    Optional<Task> findById(String id);

    List<Task> findByProject(String projectId);

    /**
     * Lock the task row for the rest of the current transaction.
     *
     * @param id Task ID
     * @return true if the task exists and is now locked
     */
    boolean lockForUpdate(String id);

    /**
     * Conditionally move a task to a new status.
     *
     * @param id             Task ID
     * @param expectedStatus Status the caller evaluated guards against
     * @param newStatus      Target status
     * @param now            Update timestamp
     * @return true if the row still had expectedStatus and was updated
     */
    boolean updateStatus(String id, String expectedStatus, String newStatus, Instant now);

    void updatePlan(String id, String plan, List<Subtask> subtasks, Instant now);

    void updatePullRequest(String id, String prLink, String branchName, Instant now);

    /**
     * Record that taskId cannot be considered resolved before dependsOnTaskId.
     */
    void addDependency(String taskId, String dependsOnTaskId);

    List<String> findDependencyIds(String taskId);
}
