package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.PhaseStatus;
import com.agentflow.core.model.TaskPhase;
import com.agentflow.core.repository.TaskPhaseRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcTaskPhaseRepository extends JdbcRepositorySupport implements TaskPhaseRepository {

    private final RowMapper<TaskPhase> rowMapper = (rs, rowNum) -> new TaskPhase(
        rs.getString("id"),
        rs.getString("task_id"),
        rs.getString("phase"),
        PhaseStatus.fromValue(rs.getString("status")),
        rs.getString("agent_run_id"),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("completed_at"))
    );

    public JdbcTaskPhaseRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    @Override
    public void save(TaskPhase phase) {
        jdbcTemplate.update("""
            INSERT INTO task_phases (id, task_id, phase, status, agent_run_id, started_at, completed_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            phase.id(),
            phase.taskId(),
            phase.phase(),
            phase.status().value(),
            phase.agentRunId(),
            toTimestamp(phase.startedAt()),
            toTimestamp(phase.completedAt())
        );
    }

    @Override
    public void activate(String phaseId, String agentRunId, Instant now) {
        jdbcTemplate.update("""
            UPDATE task_phases SET status = ?, agent_run_id = ?, started_at = ?, completed_at = NULL
            WHERE id = ?
            """,
            PhaseStatus.ACTIVE.value(), agentRunId, toTimestamp(now), phaseId);
    }

    @Override
    public Optional<TaskPhase> findActiveByTask(String taskId) {
        return jdbcTemplate.query(
            "SELECT * FROM task_phases WHERE task_id = ? AND status = ?",
            rowMapper, taskId, PhaseStatus.ACTIVE.value()
        ).stream().findFirst();
    }

    @Override
    public Optional<TaskPhase> findByTaskAndPhase(String taskId, String phase) {
        return jdbcTemplate.query(
            "SELECT * FROM task_phases WHERE task_id = ? AND phase = ?",
            rowMapper, taskId, phase
        ).stream().findFirst();
    }

    @Override
    public Optional<TaskPhase> findLatestByTask(String taskId) {
        return jdbcTemplate.query(
            "SELECT * FROM task_phases WHERE task_id = ? ORDER BY started_at DESC NULLS LAST, id LIMIT 1",
            rowMapper, taskId
        ).stream().findFirst();
    }

    @Override
    public List<TaskPhase> findByTask(String taskId) {
        return jdbcTemplate.query(
            "SELECT * FROM task_phases WHERE task_id = ? ORDER BY started_at, id",
            rowMapper, taskId);
    }

    @Override
    public boolean finishByRun(String agentRunId, PhaseStatus status, Instant now) {
        int rows = jdbcTemplate.update(
            "UPDATE task_phases SET status = ?, completed_at = ? WHERE agent_run_id = ? AND status = ?",
            status.value(), toTimestamp(now), agentRunId, PhaseStatus.ACTIVE.value());
        return rows > 0;
    }
}
