package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.ActivityEntry;
import com.agentflow.core.spi.ActivityLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class JdbcActivityLog extends JdbcRepositorySupport implements ActivityLog {

    private final RowMapper<ActivityEntry> rowMapper = (rs, rowNum) -> new ActivityEntry(
        rs.getString("id"),
        rs.getString("action"),
        rs.getString("entity_type"),
        rs.getString("entity_id"),
        rs.getString("summary"),
        readTree(rs.getString("data")),
        toInstant(rs.getTimestamp("created_at"))
    );

    public JdbcActivityLog(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    @Override
    public void log(ActivityEntry entry) {
        jdbcTemplate.update("""
            INSERT INTO activity_log (id, action, entity_type, entity_id, summary, data, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            entry.id(),
            entry.action(),
            entry.entityType(),
            entry.entityId(),
            entry.summary(),
            toJson(entry.data()),
            toTimestamp(entry.createdAt())
        );
    }

    @Override
    public List<ActivityEntry> recent(int limit) {
        return jdbcTemplate.query(
            "SELECT * FROM activity_log ORDER BY created_at DESC, id LIMIT ?",
            rowMapper, limit);
    }
}
