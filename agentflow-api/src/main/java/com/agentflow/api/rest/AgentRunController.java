package com.agentflow.api.rest;

import com.agentflow.core.model.AgentRun;
import com.agentflow.engine.service.AgentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for agent runs.
 */
@RestController
@RequestMapping("/api/v1/agent-runs")
public class AgentRunController {

    private final AgentService agentService;

    public AgentRunController(AgentService agentService) {
        this.agentService = agentService;
    }

    @GetMapping("/{runId}")
    public ResponseEntity<AgentRun> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(agentService.getRun(runId));
    }

    /**
     * Cancel a run. Stopping a finished run leaves it unchanged.
     */
    @PostMapping("/{runId}/stop")
    public ResponseEntity<AgentRun> stopRun(@PathVariable String runId) {
        agentService.stop(runId);
        return ResponseEntity.ok(agentService.getRun(runId));
    }
}
