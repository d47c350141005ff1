package com.agentflow.core.repository;

import com.agentflow.core.model.ArtifactType;
import com.agentflow.core.model.TaskArtifact;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of artifacts collected from runs.
 */
public interface TaskArtifactRepository {

    void append(TaskArtifact artifact);

    List<TaskArtifact> findByTask(String taskId);

    Optional<TaskArtifact> findLatest(String taskId, ArtifactType type);
}
