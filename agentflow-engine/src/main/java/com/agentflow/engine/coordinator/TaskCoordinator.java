package com.agentflow.engine.coordinator;

import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.model.*;
import com.agentflow.core.repository.*;
import com.agentflow.core.spi.TaskEventLog;
import com.agentflow.engine.logging.TaskEventRecorder;
import com.agentflow.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Projects, tasks and their read-side views.
 */
public class TaskCoordinator implements TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskCoordinator.class);

    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final PipelineRepository pipelineRepository;
    private final TaskPhaseRepository phaseRepository;
    private final TaskArtifactRepository artifactRepository;
    private final TaskEventLog eventLog;
    private final TaskEventRecorder recorder;
    private final Clock clock;

    public TaskCoordinator(
            ProjectRepository projectRepository,
            TaskRepository taskRepository,
            PipelineRepository pipelineRepository,
            TaskPhaseRepository phaseRepository,
            TaskArtifactRepository artifactRepository,
            TaskEventLog eventLog,
            TaskEventRecorder recorder,
            Clock clock) {
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.pipelineRepository = pipelineRepository;
        this.phaseRepository = phaseRepository;
        this.artifactRepository = artifactRepository;
        this.eventLog = eventLog;
        this.recorder = recorder;
        this.clock = clock;
    }

    @Override
    public Project createProject(NewProject request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Project name cannot be empty");
        }
        Project project = new Project(UUID.randomUUID().toString(), request.name(), request.path(),
            request.config(), clock.instant());
        projectRepository.save(project);
        recorder.activity("project_created", "project", project.id(), project.name(), null);
        log.info("Created project {} ({})", project.name(), project.id());
        return project;
    }

    @Override
    public Project getProject(String projectId) {
        return projectRepository.findById(projectId)
            .orElseThrow(() -> new NotFoundException("Project", projectId));
    }

    @Override
    public List<Project> listProjects() {
        return projectRepository.findAll();
    }

    @Override
    public Task createTask(NewTask request) {
        if (request.title() == null || request.title().isBlank()) {
            throw new IllegalArgumentException("Task title cannot be empty");
        }
        Project project = getProject(request.projectId());
        Pipeline pipeline = pipelineRepository.findById(request.pipelineId())
            .orElseThrow(() -> new NotFoundException("Pipeline", request.pipelineId()));

        Instant now = clock.instant();
        Task task = Task.create(
            project.id(),
            pipeline.id(),
            request.title(),
            request.description(),
            pipeline.initialStatus(),
            request.priority(),
            request.tags(),
            request.assignee(),
            request.metadata(),
            now
        );
        taskRepository.save(task);

        recorder.activity("task_created", "task", task.id(), task.title(),
            TaskEventRecorder.data("pipelineId", pipeline.id(), "status", task.status()));
        recorder.info(task.id(), EventCategory.SYSTEM, "Task created in status " + task.status(), null);
        log.info("Created task {} in pipeline {} with status {}", task.id(), pipeline.id(), task.status());
        return task;
    }

    @Override
    public Task getTask(String taskId) {
        return taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    @Override
    public List<Task> listTasks(String projectId) {
        return taskRepository.findByProject(projectId);
    }

    @Override
    public void addDependency(String taskId, String dependsOnTaskId) {
        if (taskId.equals(dependsOnTaskId)) {
            throw new IllegalArgumentException("A task cannot depend on itself");
        }
        getTask(taskId);
        getTask(dependsOnTaskId);
        taskRepository.addDependency(taskId, dependsOnTaskId);
        log.info("Task {} now depends on {}", taskId, dependsOnTaskId);
    }

    @Override
    public List<TaskEvent> getEvents(String taskId) {
        return eventLog.findByTask(taskId);
    }

    @Override
    public List<TaskArtifact> getArtifacts(String taskId) {
        return artifactRepository.findByTask(taskId);
    }

    @Override
    public List<TaskPhase> getPhases(String taskId) {
        return phaseRepository.findByTask(taskId);
    }
}
