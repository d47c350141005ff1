package com.agentflow.core.spi;

import java.util.Optional;

/**
 * Produces isolated working directories per task.
 * Failures are infrastructure errors and surface as WorkspaceException.
 */
public interface WorkspaceProvider {

    Optional<Workspace> get(String taskId);

    Workspace create(String branchName, String taskId);

    /**
     * Mark the task's workspace as in use. Cleanup must skip locked workspaces.
     */
    void lock(String taskId);

    void unlock(String taskId);

    boolean isLocked(String taskId);
}
