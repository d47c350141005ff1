package com.agentflow.core.repository;

import com.agentflow.core.model.Pipeline;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Pipeline persistence.
 * Pipelines are replaced administratively, never mutated by the engine.
 */
public interface PipelineRepository {

    /**
     * Insert or replace a pipeline definition.
     *
     * @param pipeline The validated pipeline
     */
    void save(Pipeline pipeline);

    Optional<Pipeline> findById(String id);

    List<Pipeline> findAll();
}
