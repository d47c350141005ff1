package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.ArtifactType;
import com.agentflow.core.model.TaskArtifact;
import com.agentflow.core.repository.TaskArtifactRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcTaskArtifactRepository extends JdbcRepositorySupport implements TaskArtifactRepository {

    private final RowMapper<TaskArtifact> rowMapper = (rs, rowNum) -> new TaskArtifact(
        rs.getString("id"),
        rs.getString("task_id"),
        ArtifactType.fromValue(rs.getString("artifact_type")),
        readTree(rs.getString("data")),
        toInstant(rs.getTimestamp("created_at"))
    );

    public JdbcTaskArtifactRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    @Override
    public void append(TaskArtifact artifact) {
        jdbcTemplate.update("""
            INSERT INTO task_artifacts (id, task_id, artifact_type, data, created_at)
            VALUES (?, ?, ?, ?, ?)
            """,
            artifact.id(),
            artifact.taskId(),
            artifact.type().value(),
            toJson(artifact.data()),
            toTimestamp(artifact.createdAt())
        );
    }

    @Override
    public List<TaskArtifact> findByTask(String taskId) {
        return jdbcTemplate.query(
            "SELECT * FROM task_artifacts WHERE task_id = ? ORDER BY created_at, id",
            rowMapper, taskId);
    }

    @Override
    public Optional<TaskArtifact> findLatest(String taskId, ArtifactType type) {
        return jdbcTemplate.query(
            "SELECT * FROM task_artifacts WHERE task_id = ? AND artifact_type = ? ORDER BY created_at DESC, id LIMIT 1",
            rowMapper, taskId, type.value()
        ).stream().findFirst();
    }
}
