package com.agentflow.core.repository;

import com.agentflow.core.model.PendingPrompt;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for PendingPrompt persistence.
 */
public interface PendingPromptRepository {

    void save(PendingPrompt prompt);

    Optional<PendingPrompt> findById(String id);

    List<PendingPrompt> findByTask(String taskId);

    /**
     * Answer a pending prompt.
     *
     * @return true if the prompt was pending and is now answered
     */
    boolean answer(String id, JsonNode response, Instant now);

    /**
     * Expire every pending prompt raised by a run.
     *
     * @return Number of prompts expired
     */
    int expireByRun(String agentRunId);
}
