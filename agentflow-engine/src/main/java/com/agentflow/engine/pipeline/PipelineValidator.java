package com.agentflow.engine.pipeline;

import com.agentflow.core.exception.PipelineConfigException;
import com.agentflow.core.model.HookKind;
import com.agentflow.core.model.Pipeline;
import com.agentflow.core.model.PipelineStatus;
import com.agentflow.core.model.Transition;
import com.agentflow.core.model.TransitionGuard;
import com.agentflow.core.model.TransitionHook;
import com.agentflow.core.model.TransitionTrigger;
import com.agentflow.engine.guard.GuardRegistry;
import com.agentflow.engine.hook.HookRegistry;

import java.util.HashSet;
import java.util.Set;

/**
 * Rejects pipeline definitions the engine could not execute.
 * Runs when a pipeline is saved, so configuration errors never surface mid-transition.
 */
public class PipelineValidator {

    private final GuardRegistry guardRegistry;
    private final HookRegistry hookRegistry;

    public PipelineValidator(GuardRegistry guardRegistry, HookRegistry hookRegistry) {
        this.guardRegistry = guardRegistry;
        this.hookRegistry = hookRegistry;
    }

    /**
     * @throws PipelineConfigException describing the first problem found
     */
    public void validate(Pipeline pipeline) {
        if (pipeline.id() == null || pipeline.id().isBlank()) {
            throw new PipelineConfigException("id", "cannot be empty");
        }
        if (pipeline.statuses().isEmpty()) {
            throw new PipelineConfigException("statuses", "cannot be empty");
        }

        Set<String> names = new HashSet<>();
        for (PipelineStatus status : pipeline.statuses()) {
            if (status.name() == null || status.name().isBlank()) {
                throw new PipelineConfigException("statuses", "status name cannot be empty");
            }
            if (!names.add(status.name())) {
                throw new PipelineConfigException("statuses", "duplicate status '" + status.name() + "'");
            }
        }

        for (Transition transition : pipeline.transitions()) {
            validateTransition(pipeline, transition);
        }
    }

    private void validateTransition(Pipeline pipeline, Transition transition) {
        String edge = transition.from() + " -> " + transition.to();
        if (!pipeline.hasStatus(transition.from())) {
            throw new PipelineConfigException("transitions",
                "transition " + edge + " starts from unknown status '" + transition.from() + "'");
        }
        if (!pipeline.hasStatus(transition.to())) {
            throw new PipelineConfigException("transitions",
                "transition " + edge + " targets unknown status '" + transition.to() + "'");
        }
        if (transition.agentOutcome() != null && transition.trigger() != TransitionTrigger.AGENT) {
            throw new PipelineConfigException("transitions",
                "transition " + edge + " declares agentOutcome but is not an agent transition");
        }

        for (TransitionGuard guard : transition.guards()) {
            if (guard.kind() == null) {
                throw new PipelineConfigException("guards", "transition " + edge + " has a guard without a name");
            }
            if (!guardRegistry.isRegistered(guard.kind())) {
                throw new PipelineConfigException("guards",
                    "guard '" + guard.kind().guardName() + "' on " + edge + " is not registered");
            }
        }

        for (TransitionHook hook : transition.hooks()) {
            if (hook.kind() == null) {
                throw new PipelineConfigException("hooks", "transition " + edge + " has a hook without a name");
            }
            if (!hookRegistry.isRegistered(hook.kind())) {
                throw new PipelineConfigException("hooks",
                    "hook '" + hook.kind().hookName() + "' on " + edge + " is not registered");
            }
            if (hook.kind() == HookKind.START_AGENT && (hook.param("mode") == null || hook.param("agentType") == null)) {
                throw new PipelineConfigException("hooks",
                    "start_agent on " + edge + " requires 'mode' and 'agentType' params");
            }
        }
    }
}
