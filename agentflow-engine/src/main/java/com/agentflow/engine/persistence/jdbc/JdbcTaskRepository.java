package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.Subtask;
import com.agentflow.core.model.Task;
import com.agentflow.core.repository.TaskRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * H2-backed task store. Status writes are conditional on the expected
 * status so a racing writer can never overwrite a newer transition.
 */
@Repository
public class JdbcTaskRepository extends JdbcRepositorySupport implements TaskRepository {

    private static final TypeReference<List<String>> TAGS = new TypeReference<>() {};
    private static final TypeReference<List<Subtask>> SUBTASKS = new TypeReference<>() {};

    private final RowMapper<Task> rowMapper = (rs, rowNum) -> new Task(
        rs.getString("id"),
        rs.getString("project_id"),
        rs.getString("pipeline_id"),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("status"),
        rs.getInt("priority"),
        readValue(rs.getString("tags"), TAGS, List.of()),
        rs.getString("assignee"),
        rs.getString("plan"),
        readValue(rs.getString("subtasks"), SUBTASKS, List.of()),
        rs.getString("pr_link"),
        rs.getString("branch_name"),
        readTree(rs.getString("metadata")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at"))
    );

    public JdbcTaskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    @Override
    public void save(Task task) {
        jdbcTemplate.update("""
            INSERT INTO tasks (
                id, project_id, pipeline_id, title, description, status, priority,
                tags, assignee, plan, subtasks, pr_link, branch_name, metadata,
                created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            task.id(),
            task.projectId(),
            task.pipelineId(),
            task.title(),
            task.description(),
            task.status(),
            task.priority(),
            toJson(task.tags()),
            task.assignee(),
            task.plan(),
            toJson(task.subtasks()),
            task.prLink(),
            task.branchName(),
            toJson(task.metadata()),
            toTimestamp(task.createdAt()),
            toTimestamp(task.updatedAt())
        );
    }

    @Override
    public Optional<Task> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM tasks WHERE id = ?", rowMapper, id)
            .stream().findFirst();
    }

    @Override
    public List<Task> findByProject(String projectId) {
        return jdbcTemplate.query(
            "SELECT * FROM tasks WHERE project_id = ? ORDER BY priority DESC, created_at",
            rowMapper, projectId);
    }

    @Override
    public boolean lockForUpdate(String id) {
        List<String> ids = jdbcTemplate.queryForList(
            "SELECT id FROM tasks WHERE id = ? FOR UPDATE", String.class, id);
        return !ids.isEmpty();
    }

    @Override
    public boolean updateStatus(String id, String expectedStatus, String newStatus, Instant now) {
        int rows = jdbcTemplate.update(
            "UPDATE tasks SET status = ?, updated_at = ? WHERE id = ? AND status = ?",
            newStatus, toTimestamp(now), id, expectedStatus);
        return rows == 1;
    }

    @Override
    public void updatePlan(String id, String plan, List<Subtask> subtasks, Instant now) {
        jdbcTemplate.update(
            "UPDATE tasks SET plan = ?, subtasks = ?, updated_at = ? WHERE id = ?",
            plan, toJson(subtasks), toTimestamp(now), id);
    }

    @Override
    public void updatePullRequest(String id, String prLink, String branchName, Instant now) {
        jdbcTemplate.update(
            "UPDATE tasks SET pr_link = ?, branch_name = ?, updated_at = ? WHERE id = ?",
            prLink, branchName, toTimestamp(now), id);
    }

    @Override
    public void addDependency(String taskId, String dependsOnTaskId) {
        jdbcTemplate.update(
            "INSERT INTO task_dependencies (task_id, depends_on_task_id) VALUES (?, ?)",
            taskId, dependsOnTaskId);
    }

    @Override
    public List<String> findDependencyIds(String taskId) {
        return jdbcTemplate.queryForList(
            "SELECT depends_on_task_id FROM task_dependencies WHERE task_id = ? ORDER BY depends_on_task_id",
            String.class, taskId);
    }
}
