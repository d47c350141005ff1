package com.agentflow.engine.service;

import com.agentflow.core.model.PendingPrompt;
import com.agentflow.core.model.TransitionResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Human answers to prompts raised by agents.
 */
public interface PromptService {

    PendingPrompt getPrompt(String promptId);

    List<PendingPrompt> listPrompts(String taskId);

    /**
     * Answer a pending prompt and resume the task.
     *
     * @param promptId The prompt
     * @param response The human's answer
     * @return The resume transition's result, or null when no transition matched
     * @throws com.agentflow.core.exception.PromptNotPendingException if already answered or expired
     */
    TransitionResult respond(String promptId, JsonNode response);
}
