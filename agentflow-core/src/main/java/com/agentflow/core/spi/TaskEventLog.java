package com.agentflow.core.spi;

import com.agentflow.core.model.TaskEvent;
import java.util.List;

/**
 * Append-only per-task event sink.
 * The engine writes to it but never reads it for control decisions.
 */
public interface TaskEventLog {

    void log(TaskEvent event);

    List<TaskEvent> findByTask(String taskId);
}
