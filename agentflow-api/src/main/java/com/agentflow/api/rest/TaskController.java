package com.agentflow.api.rest;

import com.agentflow.api.config.AgentFlowProperties;
import com.agentflow.core.model.*;
import com.agentflow.engine.service.AgentService;
import com.agentflow.engine.service.PipelineService;
import com.agentflow.engine.service.PromptService;
import com.agentflow.engine.service.TaskService;
import com.agentflow.engine.service.TaskService.NewTask;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for tasks: creation, transitions, agent runs and the task's records.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskService taskService;
    private final PipelineService pipelineService;
    private final AgentService agentService;
    private final PromptService promptService;
    private final AgentFlowProperties properties;

    public TaskController(
            TaskService taskService,
            PipelineService pipelineService,
            AgentService agentService,
            PromptService promptService,
            AgentFlowProperties properties) {
        this.taskService = taskService;
        this.pipelineService = pipelineService;
        this.agentService = agentService;
        this.promptService = promptService;
        this.properties = properties;
    }

    /**
     * Create a task in its pipeline's initial status.
     */
    @PostMapping
    public ResponseEntity<Task> createTask(@RequestBody CreateTaskRequest request) {
        Task task = taskService.createTask(new NewTask(
            request.projectId(),
            request.pipelineId(),
            request.title(),
            request.description(),
            request.priority() != null ? request.priority() : 0,
            request.tags(),
            request.assignee(),
            request.metadata()
        ));
        if (request.dependsOn() != null) {
            for (String dependency : request.dependsOn()) {
                taskService.addDependency(task.id(), dependency);
            }
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(task);
    }

    @GetMapping
    public ResponseEntity<List<Task>> listTasks(@RequestParam String projectId) {
        return ResponseEntity.ok(taskService.listTasks(projectId));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<Task> getTask(@PathVariable String taskId) {
        return ResponseEntity.ok(taskService.getTask(taskId));
    }

    // ========== Transitions ==========

    /**
     * Transitions out of the task's current status, each with a dry-run guard evaluation.
     */
    @GetMapping("/{taskId}/transitions")
    public ResponseEntity<List<TransitionOption>> describeTransitions(
            @PathVariable String taskId,
            @RequestParam(required = false) String trigger) {

        Task task = taskService.getTask(taskId);
        TransitionTrigger parsed = trigger != null ? TransitionTrigger.fromValue(trigger) : null;
        return ResponseEntity.ok(pipelineService.describeTransitions(task, parsed));
    }

    /**
     * Manually move a task. Blocked transitions come back as results, with a
     * status code matching their error.
     */
    @PostMapping("/{taskId}/transitions")
    public ResponseEntity<TransitionResult> transition(
            @PathVariable String taskId,
            @RequestBody TransitionRequest request) {

        Task task = taskService.getTask(taskId);
        TransitionResult result = pipelineService.executeTransition(
            task, request.toStatus(), TransitionContext.manual(request.actor()));
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    @GetMapping("/{taskId}/history")
    public ResponseEntity<List<TransitionHistoryEntry>> getHistory(@PathVariable String taskId) {
        taskService.getTask(taskId);
        return ResponseEntity.ok(pipelineService.getHistory(taskId));
    }

    // ========== Records ==========

    @GetMapping("/{taskId}/events")
    public ResponseEntity<List<TaskEvent>> getEvents(@PathVariable String taskId) {
        taskService.getTask(taskId);
        return ResponseEntity.ok(taskService.getEvents(taskId));
    }

    @GetMapping("/{taskId}/artifacts")
    public ResponseEntity<List<TaskArtifact>> getArtifacts(@PathVariable String taskId) {
        taskService.getTask(taskId);
        return ResponseEntity.ok(taskService.getArtifacts(taskId));
    }

    @GetMapping("/{taskId}/phases")
    public ResponseEntity<List<TaskPhase>> getPhases(@PathVariable String taskId) {
        taskService.getTask(taskId);
        return ResponseEntity.ok(taskService.getPhases(taskId));
    }

    // ========== Agents & prompts ==========

    /**
     * Start an agent run. Returns once the run is registered; the agent works in the background.
     */
    @PostMapping("/{taskId}/agent-runs")
    public ResponseEntity<AgentRun> startAgent(
            @PathVariable String taskId,
            @RequestBody StartAgentRequest request) {

        String agentType = request.agentType() != null ? request.agentType() : properties.getAgents().getDefaultType();
        AgentRun run = agentService.execute(taskId, request.mode(), agentType, null);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(run);
    }

    @GetMapping("/{taskId}/agent-runs")
    public ResponseEntity<List<AgentRun>> getAgentRuns(@PathVariable String taskId) {
        taskService.getTask(taskId);
        return ResponseEntity.ok(agentService.getRunsForTask(taskId));
    }

    @GetMapping("/{taskId}/prompts")
    public ResponseEntity<List<PendingPrompt>> getPrompts(@PathVariable String taskId) {
        taskService.getTask(taskId);
        return ResponseEntity.ok(promptService.listPrompts(taskId));
    }

    private static HttpStatus statusOf(TransitionResult result) {
        if (result.success()) {
            return HttpStatus.OK;
        }
        return switch (result.errorCode()) {
            case TASK_NOT_FOUND, PIPELINE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NO_TRANSITION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STALE_STATUS, GUARD_REJECTED -> HttpStatus.CONFLICT;
        };
    }

    // ========== DTOs ==========

    public record CreateTaskRequest(
        String projectId,
        String pipelineId,
        String title,
        String description,
        Integer priority,
        List<String> tags,
        String assignee,
        JsonNode metadata,
        List<String> dependsOn
    ) {}

    public record TransitionRequest(String toStatus, String actor) {}

    public record StartAgentRequest(String mode, String agentType) {}
}
