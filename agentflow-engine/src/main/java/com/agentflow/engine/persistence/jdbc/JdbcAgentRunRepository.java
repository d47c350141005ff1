package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.AgentRun;
import com.agentflow.core.model.AgentRunStatus;
import com.agentflow.core.repository.AgentRunRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * H2-backed agent run store.
 * Every write after creation is guarded by {@code status = 'running'}, so a
 * run reaches exactly one terminal state no matter who races to finish it.
 */
@Repository
public class JdbcAgentRunRepository extends JdbcRepositorySupport implements AgentRunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAgentRunRepository.class);

    private final RowMapper<AgentRun> rowMapper = (rs, rowNum) -> new AgentRun(
        rs.getString("id"),
        rs.getString("task_id"),
        rs.getString("agent_type"),
        rs.getString("mode"),
        AgentRunStatus.fromValue(rs.getString("status")),
        rs.getString("output"),
        rs.getString("outcome"),
        readTree(rs.getString("payload")),
        getNullableInt(rs, "exit_code"),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("completed_at")),
        getNullableLong(rs, "cost_input_tokens"),
        getNullableLong(rs, "cost_output_tokens")
    );

    public JdbcAgentRunRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    @Override
    public void save(AgentRun run) {
        jdbcTemplate.update("""
            INSERT INTO agent_runs (
                id, task_id, agent_type, mode, status, output, outcome, payload,
                exit_code, started_at, completed_at, cost_input_tokens, cost_output_tokens
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            run.id(),
            run.taskId(),
            run.agentType(),
            run.mode(),
            run.status().value(),
            run.output(),
            run.outcome(),
            toJson(run.payload()),
            run.exitCode(),
            toTimestamp(run.startedAt()),
            toTimestamp(run.completedAt()),
            run.costInputTokens(),
            run.costOutputTokens()
        );
    }

    @Override
    public Optional<AgentRun> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM agent_runs WHERE id = ?", rowMapper, id)
            .stream().findFirst();
    }

    @Override
    public List<AgentRun> findByTask(String taskId) {
        return jdbcTemplate.query(
            "SELECT * FROM agent_runs WHERE task_id = ? ORDER BY started_at, id",
            rowMapper, taskId);
    }

    @Override
    public List<AgentRun> findRunning() {
        return jdbcTemplate.query(
            "SELECT * FROM agent_runs WHERE status = ? ORDER BY started_at, id",
            rowMapper, AgentRunStatus.RUNNING.value());
    }

    @Override
    public boolean updateOutput(String id, String output) {
        int rows = jdbcTemplate.update(
            "UPDATE agent_runs SET output = ? WHERE id = ? AND status = ?",
            output, id, AgentRunStatus.RUNNING.value());
        return rows == 1;
    }

    @Override
    public boolean complete(AgentRun run) {
        int rows = jdbcTemplate.update("""
            UPDATE agent_runs SET
                status = ?,
                output = ?,
                outcome = ?,
                payload = ?,
                exit_code = ?,
                completed_at = ?,
                cost_input_tokens = ?,
                cost_output_tokens = ?
            WHERE id = ? AND status = ?
            """,
            run.status().value(),
            run.output(),
            run.outcome(),
            toJson(run.payload()),
            run.exitCode(),
            toTimestamp(run.completedAt()),
            run.costInputTokens(),
            run.costOutputTokens(),
            run.id(),
            AgentRunStatus.RUNNING.value()
        );
        if (rows == 0) {
            log.debug("Run {} already terminal, {} not applied", run.id(), run.status());
        }
        return rows == 1;
    }

    @Override
    public int countFailed(String taskId, String mode) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM agent_runs WHERE task_id = ? AND mode = ? AND status = ?",
            Integer.class, taskId, mode, AgentRunStatus.FAILED.value());
        return count != null ? count : 0;
    }
}
