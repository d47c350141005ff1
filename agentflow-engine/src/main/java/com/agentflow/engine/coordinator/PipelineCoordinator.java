package com.agentflow.engine.coordinator;

import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.model.*;
import com.agentflow.core.repository.PipelineRepository;
import com.agentflow.core.repository.TaskRepository;
import com.agentflow.core.repository.TransitionHistoryRepository;
import com.agentflow.engine.guard.GuardRegistry;
import com.agentflow.engine.hook.HookRegistry;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.logging.TaskEventRecorder;
import com.agentflow.engine.metrics.AgentFlowMetrics;
import com.agentflow.engine.pipeline.PipelineValidator;
import com.agentflow.engine.service.PipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Pipeline engine: the guarded, hooked state machine every status change goes through.
 *
 * Guard evaluation and the status write share one transaction holding the
 * task row lock, so two concurrent callers cannot both pass the guards.
 * Hooks run after the commit, synchronously and in declaration order.
 */
public class PipelineCoordinator implements PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final PipelineRepository pipelineRepository;
    private final TaskRepository taskRepository;
    private final TransitionHistoryRepository historyRepository;
    private final GuardRegistry guardRegistry;
    private final HookRegistry hookRegistry;
    private final PipelineValidator validator;
    private final TransactionTemplate transactionTemplate;
    private final TaskEventRecorder recorder;
    private final AgentFlowMetrics metrics;
    private final Clock clock;

    public PipelineCoordinator(
            PipelineRepository pipelineRepository,
            TaskRepository taskRepository,
            TransitionHistoryRepository historyRepository,
            GuardRegistry guardRegistry,
            HookRegistry hookRegistry,
            PipelineValidator validator,
            TransactionTemplate transactionTemplate,
            TaskEventRecorder recorder,
            AgentFlowMetrics metrics,
            Clock clock) {
        this.pipelineRepository = pipelineRepository;
        this.taskRepository = taskRepository;
        this.historyRepository = historyRepository;
        this.guardRegistry = guardRegistry;
        this.hookRegistry = hookRegistry;
        this.validator = validator;
        this.transactionTemplate = transactionTemplate;
        this.recorder = recorder;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Pipeline savePipeline(Pipeline pipeline) {
        validator.validate(pipeline);
        pipelineRepository.save(pipeline);
        log.info("Saved pipeline {} ({} statuses, {} transitions)",
            pipeline.id(), pipeline.statuses().size(), pipeline.transitions().size());
        return pipeline;
    }

    @Override
    public Pipeline getPipeline(String pipelineId) {
        return pipelineRepository.findById(pipelineId)
            .orElseThrow(() -> new NotFoundException("Pipeline", pipelineId));
    }

    @Override
    public List<Pipeline> listPipelines() {
        return pipelineRepository.findAll();
    }

    @Override
    public List<Transition> getValidTransitions(Task task, TransitionTrigger trigger) {
        return pipelineRepository.findById(task.pipelineId())
            .map(p -> p.transitionsFrom(task.status(), trigger))
            .orElse(List.of());
    }

    @Override
    public List<TransitionOption> describeTransitions(Task task, TransitionTrigger trigger) {
        TransitionContext context = new TransitionContext(trigger, "dry-run", null);
        List<TransitionOption> options = new ArrayList<>();
        for (Transition transition : getValidTransitions(task, trigger)) {
            List<GuardFailure> failures = new ArrayList<>();
            evaluateGuards(task, transition, context, failures);
            options.add(new TransitionOption(transition, failures.isEmpty(), failures));
        }
        return options;
    }

    @Override
    public TransitionResult executeTransition(Task task, String toStatus, TransitionContext context) {
        TransitionContext ctx = context != null ? context : TransitionContext.manual(null);

        try (LoggingContext lc = LoggingContext.forTask(task.id(), task.pipelineId())) {
            Optional<Pipeline> pipeline = pipelineRepository.findById(task.pipelineId());
            if (pipeline.isEmpty()) {
                return reject(ctx, TransitionResult.failed(TransitionError.PIPELINE_NOT_FOUND,
                    "Pipeline not found: " + task.pipelineId()));
            }

            Optional<Transition> transition = pipeline.get().findTransition(task.status(), toStatus, ctx.trigger());
            if (transition.isEmpty()) {
                return reject(ctx, TransitionResult.failed(TransitionError.NO_TRANSITION, String.format(
                    "No transition from \"%s\" to \"%s\" in pipeline \"%s\"",
                    task.status(), toStatus, pipeline.get().name())));
            }

            TransitionResult outcome = transactionTemplate.execute(status -> commit(task, transition.get(), ctx));
            if (!outcome.success()) {
                if (outcome.errorCode() == TransitionError.GUARD_REJECTED) {
                    for (GuardFailure failure : outcome.guardFailures()) {
                        metrics.guardRejected(failure.guard());
                    }
                    log.warn("Transition {} -> {} of task {} rejected: {}",
                        task.status(), toStatus, task.id(), outcome.error());
                    recorder.warning(task.id(), EventCategory.STATUS_CHANGE, outcome.error(),
                        TaskEventRecorder.data(
                            "fromStatus", task.status(),
                            "toStatus", toStatus,
                            "guardFailures", outcome.guardFailures()));
                }
                return reject(ctx, outcome);
            }

            Task committed = outcome.task();
            log.info("Task {} moved {} -> {} ({} by {})",
                task.id(), transition.get().from(), toStatus, ctx.trigger().value(), ctx.actor());
            recorder.info(task.id(), EventCategory.STATUS_CHANGE,
                String.format("Status changed: %s → %s", transition.get().from(), toStatus),
                TaskEventRecorder.data(
                    "fromStatus", transition.get().from(),
                    "toStatus", toStatus,
                    "trigger", ctx.trigger().value(),
                    "actor", ctx.actor()));
            metrics.transitionAttempted(ctx.trigger(), "committed");

            List<HookFailure> hookFailures = runHooks(committed, transition.get(), ctx);
            return TransitionResult.committed(committed, hookFailures);
        }
    }

    @Override
    public List<TransitionHistoryEntry> getHistory(String taskId) {
        return historyRepository.findByTask(taskId);
    }

    // ========== Private Helpers ==========

    /**
     * Runs inside the transaction: lock, re-read, guards, conditional write, history.
     */
    private TransitionResult commit(Task task, Transition transition, TransitionContext ctx) {
        if (!taskRepository.lockForUpdate(task.id())) {
            return TransitionResult.failed(TransitionError.TASK_NOT_FOUND, "Task not found: " + task.id());
        }
        Task current = taskRepository.findById(task.id()).orElse(null);
        if (current == null) {
            return TransitionResult.failed(TransitionError.TASK_NOT_FOUND, "Task not found: " + task.id());
        }
        if (!current.status().equals(task.status())) {
            return stale(task.status(), current.status());
        }

        List<GuardFailure> failures = new ArrayList<>();
        Map<String, GuardResult> guardResults = evaluateGuards(current, transition, ctx, failures);
        if (!failures.isEmpty()) {
            return TransitionResult.rejected(failures);
        }

        Instant now = clock.instant();
        if (!taskRepository.updateStatus(current.id(), current.status(), transition.to(), now)) {
            return stale(task.status(), "unknown");
        }
        historyRepository.append(TransitionHistoryEntry.record(
            current.id(), transition.from(), transition.to(), ctx.trigger(), ctx.actor(), guardResults, now));

        return TransitionResult.committed(current.withStatus(transition.to(), now), List.of());
    }

    /**
     * Evaluate every guard; there is no short-circuit, so all failures are reported.
     */
    private Map<String, GuardResult> evaluateGuards(
            Task task, Transition transition, TransitionContext ctx, List<GuardFailure> failures) {
        Map<String, GuardResult> results = new LinkedHashMap<>();
        for (TransitionGuard guard : transition.guards()) {
            String name = guard.kind().guardName();
            GuardResult result = guardRegistry.get(guard.kind()).evaluate(task, transition, ctx, guard.params());
            results.put(name, result);
            if (!result.allowed()) {
                failures.add(new GuardFailure(name, result.reason()));
            }
        }
        return results;
    }

    private List<HookFailure> runHooks(Task task, Transition transition, TransitionContext ctx) {
        List<HookFailure> failures = new ArrayList<>();
        for (TransitionHook hook : transition.hooks()) {
            String name = hook.kind().hookName();
            HookPolicy policy = hook.effectivePolicy();
            String error = runHook(task, transition, ctx, hook);
            if (error == null) {
                continue;
            }
            metrics.hookFailed(name, policy);

            switch (policy) {
                case REQUIRED -> {
                    log.error("Required hook {} failed for task {}: {}", name, task.id(), error);
                    failures.add(new HookFailure(name, policy, error));
                    recorder.error(task.id(), EventCategory.SYSTEM, "Required hook " + name + " failed: " + error,
                        TaskEventRecorder.data("hook", name, "policy", policy.value()));
                    // Already-applied side effects of earlier hooks are not undone
                    return failures;
                }
                case BEST_EFFORT -> {
                    log.warn("Hook {} failed for task {}: {}", name, task.id(), error);
                    failures.add(new HookFailure(name, policy, error));
                    recorder.warning(task.id(), EventCategory.SYSTEM, "Hook " + name + " failed: " + error,
                        TaskEventRecorder.data("hook", name, "policy", policy.value()));
                }
                case FIRE_AND_FORGET -> log.warn("Fire-and-forget hook {} failed for task {}: {}",
                    name, task.id(), error);
            }
        }
        return failures;
    }

    /**
     * @return null on success, otherwise the failure message
     */
    private String runHook(Task task, Transition transition, TransitionContext ctx, TransitionHook hook) {
        try {
            HookResult result = hookRegistry.get(hook.kind()).execute(task, transition, ctx, hook);
            if (result == null || result.success()) {
                return null;
            }
            return result.error() != null ? result.error() : "hook reported failure";
        } catch (RuntimeException e) {
            log.debug("Hook {} threw", hook.kind().hookName(), e);
            return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
    }

    private TransitionResult reject(TransitionContext ctx, TransitionResult result) {
        metrics.transitionAttempted(ctx.trigger(), result.errorCode().name().toLowerCase());
        if (result.errorCode() != TransitionError.GUARD_REJECTED) {
            log.info("Transition not executed: {}", result.error());
        }
        return result;
    }

    private static TransitionResult stale(String expected, String actual) {
        return TransitionResult.failed(TransitionError.STALE_STATUS,
            String.format("Task status changed: expected \"%s\", got \"%s\"", expected, actual));
    }
}
