package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.Pipeline;
import com.agentflow.core.model.PipelineStatus;
import com.agentflow.core.model.Transition;
import com.agentflow.core.repository.PipelineRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Pipelines stored with statuses and transitions as JSON columns.
 */
@Repository
public class JdbcPipelineRepository extends JdbcRepositorySupport implements PipelineRepository {

    private static final TypeReference<List<PipelineStatus>> STATUSES = new TypeReference<>() {};
    private static final TypeReference<List<Transition>> TRANSITIONS = new TypeReference<>() {};

    private final Clock clock;
    private final RowMapper<Pipeline> rowMapper = (rs, rowNum) -> new Pipeline(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("task_type"),
        readValue(rs.getString("statuses"), STATUSES, List.of()),
        readValue(rs.getString("transitions"), TRANSITIONS, List.of())
    );

    public JdbcPipelineRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        super(jdbcTemplate, objectMapper);
        this.clock = clock;
    }

    @Override
    @Transactional
    public void save(Pipeline pipeline) {
        Timestamp now = Timestamp.from(clock.instant());
        int updated = jdbcTemplate.update("""
            UPDATE pipelines SET
                name = ?, description = ?, task_type = ?,
                statuses = ?, transitions = ?, updated_at = ?
            WHERE id = ?
            """,
            pipeline.name(),
            pipeline.description(),
            pipeline.taskType(),
            toJson(pipeline.statuses()),
            toJson(pipeline.transitions()),
            now,
            pipeline.id()
        );
        if (updated == 0) {
            jdbcTemplate.update("""
                INSERT INTO pipelines (id, name, description, task_type, statuses, transitions, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                pipeline.id(),
                pipeline.name(),
                pipeline.description(),
                pipeline.taskType(),
                toJson(pipeline.statuses()),
                toJson(pipeline.transitions()),
                now,
                now
            );
        }
    }

    @Override
    public Optional<Pipeline> findById(String id) {
        List<Pipeline> results = jdbcTemplate.query(
            "SELECT * FROM pipelines WHERE id = ?", rowMapper, id);
        return results.stream().findFirst();
    }

    @Override
    public List<Pipeline> findAll() {
        return jdbcTemplate.query("SELECT * FROM pipelines ORDER BY name", rowMapper);
    }
}
