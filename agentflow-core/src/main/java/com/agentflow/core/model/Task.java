package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The unit of work moving through a pipeline.
 *
 * Primary Key: id
 *
 * Invariants:
 * - status is always a status of the owning pipeline
 * - status changes only through a committed pipeline transition
 */
public record Task(
    String id,
    String projectId,
    String pipelineId,
    String title,
    String description,
    String status,
    int priority,
    List<String> tags,
    String assignee,
    String plan,
    List<Subtask> subtasks,
    String prLink,
    String branchName,
    JsonNode metadata,
    Instant createdAt,
    Instant updatedAt
) {
    public Task {
        tags = tags == null ? List.of() : List.copyOf(tags);
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
    }

    /**
     * Create a new task in the given initial status.
     */
    public static Task create(
            String projectId,
            String pipelineId,
            String title,
            String description,
            String initialStatus,
            int priority,
            List<String> tags,
            String assignee,
            JsonNode metadata,
            Instant now) {
        return new Task(
            UUID.randomUUID().toString(),
            projectId,
            pipelineId,
            title,
            description,
            initialStatus,
            priority,
            tags,
            assignee,
            null,
            List.of(),
            null,
            null,
            metadata,
            now,
            now
        );
    }

    /**
     * Create a copy with a new status. Only the pipeline engine persists this.
     */
    public Task withStatus(String newStatus, Instant now) {
        return new Task(
            id, projectId, pipelineId, title, description, newStatus, priority,
            tags, assignee, plan, subtasks, prLink, branchName, metadata,
            createdAt, now
        );
    }

    /**
     * Create a copy with a plan and its subtasks.
     */
    public Task withPlan(String newPlan, List<Subtask> newSubtasks, Instant now) {
        return new Task(
            id, projectId, pipelineId, title, description, status, priority,
            tags, assignee, newPlan, newSubtasks, prLink, branchName, metadata,
            createdAt, now
        );
    }

    /**
     * Create a copy with pull request details.
     */
    public Task withPullRequest(String newPrLink, String newBranchName, Instant now) {
        return new Task(
            id, projectId, pipelineId, title, description, status, priority,
            tags, assignee, plan, subtasks, newPrLink, newBranchName, metadata,
            createdAt, now
        );
    }

    public boolean hasPullRequest() {
        return prLink != null && !prLink.isBlank();
    }
}
