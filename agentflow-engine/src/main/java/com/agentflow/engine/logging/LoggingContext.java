package com.agentflow.engine.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the task and run they belong to.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forRun(taskId, agentRunId)) {
 *     log.info("Agent started"); // Automatically includes taskId, agentRunId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String AGENT_RUN_ID = "agentRunId";
    public static final String PIPELINE_ID = "pipelineId";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous;

    private LoggingContext() {
        this.previous = MDC.getCopyOfContextMap();
    }

    /**
     * Create a logging context for a transition on a task.
     */
    public static LoggingContext forTask(String taskId, String pipelineId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(TASK_ID, taskId);
        putIfPresent(PIPELINE_ID, pipelineId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for an agent run.
     */
    public static LoggingContext forRun(String taskId, String agentRunId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(TASK_ID, taskId);
        putIfPresent(AGENT_RUN_ID, agentRunId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Capture the caller's MDC so a background thread can continue the same trace.
     */
    public static Map<String, String> capture() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * Install a captured MDC on the current thread.
     */
    public static LoggingContext restore(Map<String, String> captured) {
        LoggingContext ctx = new LoggingContext();
        if (captured != null) {
            MDC.setContextMap(captured);
        }
        return ctx;
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }
}
