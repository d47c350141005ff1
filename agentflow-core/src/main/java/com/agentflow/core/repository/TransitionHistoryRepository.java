package com.agentflow.core.repository;

import com.agentflow.core.model.TransitionHistoryEntry;
import java.util.List;

/**
 * Append-only audit log of committed transitions.
 */
public interface TransitionHistoryRepository {

    void append(TransitionHistoryEntry entry);

    /**
     * @return Entries of a task, oldest first
     */
    List<TransitionHistoryEntry> findByTask(String taskId);
}
