package com.agentflow.core.repository;

import com.agentflow.core.model.Project;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Project persistence.
 */
public interface ProjectRepository {

    void save(Project project);

    Optional<Project> findById(String id);

    List<Project> findAll();
}
