package com.agentflow.api.rest;

import com.agentflow.core.model.Project;
import com.agentflow.engine.service.TaskService;
import com.agentflow.engine.service.TaskService.NewProject;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for projects.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private final TaskService taskService;

    public ProjectController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping
    public ResponseEntity<Project> createProject(@RequestBody CreateProjectRequest request) {
        Project project = taskService.createProject(new NewProject(request.name(), request.path(), request.config()));
        return ResponseEntity.status(HttpStatus.CREATED).body(project);
    }

    @GetMapping
    public ResponseEntity<List<Project>> listProjects() {
        return ResponseEntity.ok(taskService.listProjects());
    }

    @GetMapping("/{projectId}")
    public ResponseEntity<Project> getProject(@PathVariable String projectId) {
        return ResponseEntity.ok(taskService.getProject(projectId));
    }

    // ========== DTOs ==========

    public record CreateProjectRequest(String name, String path, JsonNode config) {}
}
