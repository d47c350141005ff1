package com.agentflow.engine.logging;

import com.agentflow.core.model.ActivityEntry;
import com.agentflow.core.model.EventCategory;
import com.agentflow.core.model.EventSeverity;
import com.agentflow.core.model.TaskEvent;
import com.agentflow.core.spi.ActivityLog;
import com.agentflow.core.spi.TaskEventLog;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes task events and activity entries. The sinks are observational, so a
 * failing write is logged and never propagated into the transition or run.
 */
public class TaskEventRecorder {

    private static final Logger log = LoggerFactory.getLogger(TaskEventRecorder.class);

    private final TaskEventLog eventLog;
    private final ActivityLog activityLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TaskEventRecorder(TaskEventLog eventLog, ActivityLog activityLog, ObjectMapper objectMapper, Clock clock) {
        this.eventLog = eventLog;
        this.activityLog = activityLog;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void info(String taskId, EventCategory category, String message, Map<String, ?> data) {
        record(taskId, category, EventSeverity.INFO, message, data);
    }

    public void warning(String taskId, EventCategory category, String message, Map<String, ?> data) {
        record(taskId, category, EventSeverity.WARNING, message, data);
    }

    public void error(String taskId, EventCategory category, String message, Map<String, ?> data) {
        record(taskId, category, EventSeverity.ERROR, message, data);
    }

    public void debug(String taskId, EventCategory category, String message, Map<String, ?> data) {
        record(taskId, category, EventSeverity.DEBUG, message, data);
    }

    public void record(String taskId, EventCategory category, EventSeverity severity, String message, Map<String, ?> data) {
        try {
            eventLog.log(TaskEvent.of(taskId, category, severity, message, toTree(data), clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Failed to write task event '{}' for task {}: {}", message, taskId, e.getMessage());
        }
    }

    public void activity(String action, String entityType, String entityId, String summary, Map<String, ?> data) {
        try {
            activityLog.log(ActivityEntry.of(action, entityType, entityId, summary, toTree(data), clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Failed to write activity '{}' for {} {}: {}", action, entityType, entityId, e.getMessage());
        }
    }

    /**
     * Event data from alternating keys and values; null values are skipped.
     */
    public static Map<String, Object> data(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }

    private JsonNode toTree(Map<String, ?> data) {
        return data == null ? null : objectMapper.valueToTree(data);
    }
}
