package com.agentflow.engine.service;

import com.agentflow.core.model.Pipeline;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.Transition;
import com.agentflow.core.model.TransitionContext;
import com.agentflow.core.model.TransitionHistoryEntry;
import com.agentflow.core.model.TransitionOption;
import com.agentflow.core.model.TransitionResult;
import com.agentflow.core.model.TransitionTrigger;

import java.util.List;

/**
 * The pipeline engine. The only path through which a task's status changes.
 */
public interface PipelineService {

    /**
     * Validate and store a pipeline definition, replacing one with the same id.
     *
     * @param pipeline The pipeline definition
     * @return The stored pipeline
     * @throws com.agentflow.core.exception.PipelineConfigException if the definition is invalid
     */
    Pipeline savePipeline(Pipeline pipeline);

    /**
     * Get pipeline by ID.
     *
     * @throws com.agentflow.core.exception.NotFoundException if no such pipeline exists
     */
    Pipeline getPipeline(String pipelineId);

    List<Pipeline> listPipelines();

    /**
     * Transitions leaving the task's current status.
     *
     * @param task    The task
     * @param trigger Optional trigger filter, null for all
     * @return Matching transitions in declaration order; empty when the pipeline is missing
     */
    List<Transition> getValidTransitions(Task task, TransitionTrigger trigger);

    /**
     * Same as {@link #getValidTransitions} with a dry-run guard evaluation of each candidate.
     * Nothing is written.
     */
    List<TransitionOption> describeTransitions(Task task, TransitionTrigger trigger);

    /**
     * Move a task to a new status.
     *
     * Guards are evaluated and the status is committed atomically; hooks run
     * after the commit and cannot undo it.
     *
     * @param task     The task as the caller last saw it
     * @param toStatus Target status
     * @param context  Trigger, actor and extra data
     * @return The result; blocked transitions are results, not exceptions
     */
    TransitionResult executeTransition(Task task, String toStatus, TransitionContext context);

    /**
     * Committed transitions of a task, oldest first.
     */
    List<TransitionHistoryEntry> getHistory(String taskId);
}
