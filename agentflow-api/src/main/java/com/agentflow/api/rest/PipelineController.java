package com.agentflow.api.rest;

import com.agentflow.core.model.Pipeline;
import com.agentflow.engine.service.PipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for pipeline definitions.
 */
@RestController
@RequestMapping("/api/v1/pipelines")
public class PipelineController {

    private final PipelineService pipelineService;

    public PipelineController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @GetMapping
    public ResponseEntity<List<Pipeline>> listPipelines() {
        return ResponseEntity.ok(pipelineService.listPipelines());
    }

    @GetMapping("/{pipelineId}")
    public ResponseEntity<Pipeline> getPipeline(@PathVariable String pipelineId) {
        return ResponseEntity.ok(pipelineService.getPipeline(pipelineId));
    }

    /**
     * Validate and create or replace a pipeline.
     */
    @PostMapping
    public ResponseEntity<Pipeline> savePipeline(@RequestBody Pipeline pipeline) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(pipelineService.savePipeline(pipeline));
    }
}
