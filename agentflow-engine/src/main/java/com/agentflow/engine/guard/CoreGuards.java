package com.agentflow.engine.guard;

import com.agentflow.core.model.GuardKind;
import com.agentflow.core.model.GuardResult;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskPhase;
import com.agentflow.core.model.Transition;
import com.agentflow.core.model.TransitionContext;
import com.agentflow.core.repository.AgentRunRepository;
import com.agentflow.core.repository.PipelineRepository;
import com.agentflow.core.repository.TaskPhaseRepository;
import com.agentflow.core.repository.TaskRepository;

import java.util.Map;
import java.util.Optional;

/**
 * Built-in guards.
 */
public class CoreGuards {

    static final int DEFAULT_MAX_RETRIES = 3;

    private final TaskRepository taskRepository;
    private final PipelineRepository pipelineRepository;
    private final TaskPhaseRepository phaseRepository;
    private final AgentRunRepository runRepository;

    public CoreGuards(
            TaskRepository taskRepository,
            PipelineRepository pipelineRepository,
            TaskPhaseRepository phaseRepository,
            AgentRunRepository runRepository) {
        this.taskRepository = taskRepository;
        this.pipelineRepository = pipelineRepository;
        this.phaseRepository = phaseRepository;
        this.runRepository = runRepository;
    }

    public void registerAll(GuardRegistry registry) {
        registry.register(GuardKind.HAS_PR, this::hasPr)
            .register(GuardKind.DEPENDENCIES_RESOLVED, this::dependenciesResolved)
            .register(GuardKind.NO_RUNNING_AGENT, this::noRunningAgent)
            .register(GuardKind.MAX_RETRIES, this::maxRetries);
    }

    GuardResult hasPr(Task task, Transition transition, TransitionContext context, Map<String, Object> params) {
        if (task.hasPullRequest()) {
            return GuardResult.allow();
        }
        return GuardResult.deny("Task must have a PR link");
    }

    /**
     * Dependencies that no longer exist are ignored.
     */
    GuardResult dependenciesResolved(Task task, Transition transition, TransitionContext context, Map<String, Object> params) {
        int unresolved = 0;
        for (String dependencyId : taskRepository.findDependencyIds(task.id())) {
            Optional<Task> dependency = taskRepository.findById(dependencyId);
            if (dependency.isEmpty()) {
                continue;
            }
            boolean isFinal = pipelineRepository.findById(dependency.get().pipelineId())
                .map(p -> p.isFinalStatus(dependency.get().status()))
                .orElse(false);
            if (!isFinal) {
                unresolved++;
            }
        }
        if (unresolved == 0) {
            return GuardResult.allow();
        }
        return GuardResult.deny(unresolved + " unresolved dependencies");
    }

    GuardResult noRunningAgent(Task task, Transition transition, TransitionContext context, Map<String, Object> params) {
        Optional<TaskPhase> active = phaseRepository.findActiveByTask(task.id());
        if (active.isPresent()) {
            return GuardResult.deny("An agent is already running for this task (phase '"
                + active.get().phase() + "')");
        }
        return GuardResult.allow();
    }

    /**
     * Counts failed runs of the configured mode, or of the task's most recent
     * phase when no mode is configured.
     */
    GuardResult maxRetries(Task task, Transition transition, TransitionContext context, Map<String, Object> params) {
        Object maxParam = params.get("max");
        int max = maxParam instanceof Number ? ((Number) maxParam).intValue() : DEFAULT_MAX_RETRIES;
        Object modeParam = params.get("mode");
        String mode = modeParam != null
            ? modeParam.toString()
            : phaseRepository.findLatestByTask(task.id()).map(TaskPhase::phase).orElse(null);
        if (mode == null) {
            return GuardResult.allow();
        }
        int failed = runRepository.countFailed(task.id(), mode);
        if (failed <= max) {
            return GuardResult.allow();
        }
        return GuardResult.deny(String.format(
            "Max retries (%d) exceeded for mode '%s': %d failed runs", max, mode, failed));
    }
}
