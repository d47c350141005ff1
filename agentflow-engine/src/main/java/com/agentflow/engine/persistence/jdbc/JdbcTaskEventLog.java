package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.EventCategory;
import com.agentflow.core.model.EventSeverity;
import com.agentflow.core.model.TaskEvent;
import com.agentflow.core.spi.TaskEventLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class JdbcTaskEventLog extends JdbcRepositorySupport implements TaskEventLog {

    private final RowMapper<TaskEvent> rowMapper = (rs, rowNum) -> new TaskEvent(
        rs.getString("id"),
        rs.getString("task_id"),
        EventCategory.fromValue(rs.getString("category")),
        EventSeverity.fromValue(rs.getString("severity")),
        rs.getString("message"),
        readTree(rs.getString("data")),
        toInstant(rs.getTimestamp("created_at"))
    );

    public JdbcTaskEventLog(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    @Override
    public void log(TaskEvent event) {
        jdbcTemplate.update("""
            INSERT INTO task_events (id, task_id, category, severity, message, data, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            event.id(),
            event.taskId(),
            event.category().value(),
            event.severity().value(),
            event.message(),
            toJson(event.data()),
            toTimestamp(event.createdAt())
        );
    }

    @Override
    public List<TaskEvent> findByTask(String taskId) {
        return jdbcTemplate.query(
            "SELECT * FROM task_events WHERE task_id = ? ORDER BY created_at, id",
            rowMapper, taskId);
    }
}
