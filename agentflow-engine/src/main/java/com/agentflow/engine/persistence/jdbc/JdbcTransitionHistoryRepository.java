package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.GuardResult;
import com.agentflow.core.model.TransitionHistoryEntry;
import com.agentflow.core.model.TransitionTrigger;
import com.agentflow.core.repository.TransitionHistoryRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class JdbcTransitionHistoryRepository extends JdbcRepositorySupport implements TransitionHistoryRepository {

    private static final TypeReference<LinkedHashMap<String, GuardResult>> GUARD_RESULTS = new TypeReference<>() {};

    private final RowMapper<TransitionHistoryEntry> rowMapper = (rs, rowNum) -> new TransitionHistoryEntry(
        rs.getString("id"),
        rs.getString("task_id"),
        rs.getString("from_status"),
        rs.getString("to_status"),
        TransitionTrigger.fromValue(rs.getString("trigger_type")),
        rs.getString("actor"),
        readValue(rs.getString("guard_results"), GUARD_RESULTS, new LinkedHashMap<>()),
        toInstant(rs.getTimestamp("created_at"))
    );

    public JdbcTransitionHistoryRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    @Override
    public void append(TransitionHistoryEntry entry) {
        Map<String, GuardResult> guardResults = entry.guardResults();
        jdbcTemplate.update("""
            INSERT INTO transition_history (
                id, task_id, from_status, to_status, trigger_type, actor, guard_results, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """,
            entry.id(),
            entry.taskId(),
            entry.fromStatus(),
            entry.toStatus(),
            entry.trigger().value(),
            entry.actor(),
            toJson(guardResults),
            toTimestamp(entry.createdAt())
        );
    }

    @Override
    public List<TransitionHistoryEntry> findByTask(String taskId) {
        return jdbcTemplate.query(
            "SELECT * FROM transition_history WHERE task_id = ? ORDER BY created_at, id",
            rowMapper, taskId);
    }
}
