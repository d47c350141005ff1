package com.agentflow.api.config;

import com.agentflow.core.model.Pipeline;
import com.agentflow.engine.service.PipelineService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Validates and upserts the bundled pipeline definitions.
 */
@Component
public class PipelineSeeder {

    private static final Logger log = LoggerFactory.getLogger(PipelineSeeder.class);

    private final PipelineService pipelineService;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final AgentFlowProperties properties;

    public PipelineSeeder(PipelineService pipelineService, ObjectMapper objectMapper,
                          ResourceLoader resourceLoader, AgentFlowProperties properties) {
        this.pipelineService = pipelineService;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    /**
     * @return the seeded pipelines
     * @throws com.agentflow.core.exception.PipelineConfigException if a seeded pipeline is invalid
     */
    public List<Pipeline> seed() {
        String location = properties.getPipelines().getSeedLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("No pipeline seed file at {}", location);
            return List.of();
        }

        List<Pipeline> pipelines;
        try (InputStream in = resource.getInputStream()) {
            pipelines = objectMapper.readValue(in, new TypeReference<List<Pipeline>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read pipeline seed file " + location, e);
        }

        for (Pipeline pipeline : pipelines) {
            pipelineService.savePipeline(pipeline);
            log.info("Seeded pipeline {} ({} statuses, {} transitions)",
                pipeline.id(), pipeline.statuses().size(), pipeline.transitions().size());
        }
        return pipelines;
    }
}
