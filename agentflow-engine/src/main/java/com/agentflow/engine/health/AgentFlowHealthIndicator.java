package com.agentflow.engine.health;

import com.agentflow.engine.metrics.AgentFlowMetrics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Custom health indicator for agentflow.
 * Reports health status based on:
 * - Database connectivity
 * - Agent runs by status, and runs live in this process
 * - Supervisor state
 */
@Component
public class AgentFlowHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;
    private final AgentFlowMetrics metrics;
    private final ObjectProvider<SupervisorState> supervisorState;

    public AgentFlowHealthIndicator(
            JdbcTemplate jdbcTemplate,
            AgentFlowMetrics metrics,
            ObjectProvider<SupervisorState> supervisorState) {
        this.jdbcTemplate = jdbcTemplate;
        this.metrics = metrics;
        this.supervisorState = supervisorState;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        if (!checkDatabase(details)) {
            return Health.down()
                .withDetails(details)
                .build();
        }

        checkRuns(details);
        boolean supervisorUp = checkSupervisor(details);

        Health.Builder builder = supervisorUp ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }

    private boolean checkDatabase(Map<String, Object> details) {
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            details.put("database", "connected");
            return result != null && result == 1;
        } catch (Exception e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }

    private void checkRuns(Map<String, Object> details) {
        try {
            Map<String, Integer> runCounts = new HashMap<>();
            String sql = """
                SELECT status, COUNT(*) AS count
                FROM agent_runs
                GROUP BY status
                """;
            jdbcTemplate.query(sql, (rs) -> {
                runCounts.put(rs.getString("status"), rs.getInt("count"));
            });
            details.put("agentRuns", runCounts);
            details.put("runningRuns", runCounts.getOrDefault("running", 0));
            details.put("activeInProcess", metrics.getActiveRuns());
        } catch (Exception e) {
            details.put("agentRunsError", e.getMessage());
        }
    }

    /**
     * A context without a supervisor (tools, tests) is not unhealthy.
     */
    private boolean checkSupervisor(Map<String, Object> details) {
        SupervisorState supervisor = supervisorState.getIfAvailable();
        if (supervisor == null) {
            details.put("supervisor", "absent");
            return true;
        }
        details.put("supervisor", supervisor.isRunning() ? "running" : "stopped");
        if (supervisor.lastSweepAt() != null) {
            details.put("supervisorLastSweep", supervisor.lastSweepAt().toString());
        }
        return supervisor.isRunning();
    }
}
