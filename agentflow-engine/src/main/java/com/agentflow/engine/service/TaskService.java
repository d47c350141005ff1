package com.agentflow.engine.service;

import com.agentflow.core.model.Project;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskArtifact;
import com.agentflow.core.model.TaskEvent;
import com.agentflow.core.model.TaskPhase;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Task and project bookkeeping. Status changes go through {@link PipelineService}.
 */
public interface TaskService {

    Project createProject(NewProject request);

    Project getProject(String projectId);

    List<Project> listProjects();

    /**
     * Create a task in its pipeline's initial status.
     *
     * @throws com.agentflow.core.exception.NotFoundException if the project or pipeline is missing
     */
    Task createTask(NewTask request);

    Task getTask(String taskId);

    List<Task> listTasks(String projectId);

    /**
     * Record that a task depends on another task.
     */
    void addDependency(String taskId, String dependsOnTaskId);

    List<TaskEvent> getEvents(String taskId);

    List<TaskArtifact> getArtifacts(String taskId);

    List<TaskPhase> getPhases(String taskId);

    record NewProject(String name, String path, JsonNode config) {}

    record NewTask(
        String projectId,
        String pipelineId,
        String title,
        String description,
        int priority,
        List<String> tags,
        String assignee,
        JsonNode metadata
    ) {}
}
