package com.agentflow.api.rest;

import com.agentflow.core.model.PendingPrompt;
import com.agentflow.core.model.TransitionResult;
import com.agentflow.engine.service.PromptService;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for prompts raised by agents.
 */
@RestController
@RequestMapping("/api/v1/prompts")
public class PromptController {

    private final PromptService promptService;

    public PromptController(PromptService promptService) {
        this.promptService = promptService;
    }

    @GetMapping("/{promptId}")
    public ResponseEntity<PendingPrompt> getPrompt(@PathVariable String promptId) {
        return ResponseEntity.ok(promptService.getPrompt(promptId));
    }

    /**
     * Answer a pending prompt. The task resumes when a matching agent transition exists.
     */
    @PostMapping("/{promptId}/response")
    public ResponseEntity<PromptResponse> respond(
            @PathVariable String promptId,
            @RequestBody JsonNode response) {

        TransitionResult resumed = promptService.respond(promptId, response);
        return ResponseEntity.ok(new PromptResponse(promptService.getPrompt(promptId), resumed));
    }

    // ========== DTOs ==========

    /**
     * @param resumed null when no resume transition matched the prompt
     */
    public record PromptResponse(PendingPrompt prompt, TransitionResult resumed) {}
}
