package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.PendingPrompt;
import com.agentflow.core.model.PromptStatus;
import com.agentflow.core.repository.PendingPromptRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcPendingPromptRepository extends JdbcRepositorySupport implements PendingPromptRepository {

    private final RowMapper<PendingPrompt> rowMapper = (rs, rowNum) -> new PendingPrompt(
        rs.getString("id"),
        rs.getString("task_id"),
        rs.getString("agent_run_id"),
        rs.getString("prompt_type"),
        readTree(rs.getString("payload")),
        readTree(rs.getString("response")),
        rs.getString("resume_outcome"),
        PromptStatus.fromValue(rs.getString("status")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("answered_at"))
    );

    public JdbcPendingPromptRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    @Override
    public void save(PendingPrompt prompt) {
        jdbcTemplate.update("""
            INSERT INTO pending_prompts (
                id, task_id, agent_run_id, prompt_type, payload, response,
                resume_outcome, status, created_at, answered_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            prompt.id(),
            prompt.taskId(),
            prompt.agentRunId(),
            prompt.promptType(),
            toJson(prompt.payload()),
            toJson(prompt.response()),
            prompt.resumeOutcome(),
            prompt.status().value(),
            toTimestamp(prompt.createdAt()),
            toTimestamp(prompt.answeredAt())
        );
    }

    @Override
    public Optional<PendingPrompt> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM pending_prompts WHERE id = ?", rowMapper, id)
            .stream().findFirst();
    }

    @Override
    public List<PendingPrompt> findByTask(String taskId) {
        return jdbcTemplate.query(
            "SELECT * FROM pending_prompts WHERE task_id = ? ORDER BY created_at, id",
            rowMapper, taskId);
    }

    @Override
    public boolean answer(String id, JsonNode response, Instant now) {
        int rows = jdbcTemplate.update(
            "UPDATE pending_prompts SET status = ?, response = ?, answered_at = ? WHERE id = ? AND status = ?",
            PromptStatus.ANSWERED.value(), toJson(response), toTimestamp(now), id, PromptStatus.PENDING.value());
        return rows == 1;
    }

    @Override
    public int expireByRun(String agentRunId) {
        return jdbcTemplate.update(
            "UPDATE pending_prompts SET status = ? WHERE agent_run_id = ? AND status = ?",
            PromptStatus.EXPIRED.value(), agentRunId, PromptStatus.PENDING.value());
    }
}
