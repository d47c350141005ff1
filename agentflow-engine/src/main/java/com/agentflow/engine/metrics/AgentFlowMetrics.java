package com.agentflow.engine.metrics;

import com.agentflow.core.model.AgentRunStatus;
import com.agentflow.core.model.HookPolicy;
import com.agentflow.core.model.TransitionTrigger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the pipeline engine and agent runs.
 *
 * Metrics exposed:
 * - Transitions by trigger and result
 * - Guard rejections and hook failures
 * - Agent runs by type and terminal status, with duration
 * - Live background runs
 * - Supervisor timeouts and startup recoveries
 */
public class AgentFlowMetrics {

    public static final String TRANSITIONS = "agentflow.transitions";
    public static final String GUARD_REJECTIONS = "agentflow.guard.rejections";
    public static final String HOOK_FAILURES = "agentflow.hook.failures";
    public static final String AGENT_RUNS_STARTED = "agentflow.agent.runs.started";
    public static final String AGENT_RUNS_FINISHED = "agentflow.agent.runs.finished";
    public static final String AGENT_RUN_DURATION = "agentflow.agent.run.duration";
    public static final String AGENT_RUNS_ACTIVE = "agentflow.agent.runs.active";
    public static final String SUPERVISOR_TIMEOUTS = "agentflow.supervisor.timeouts";
    public static final String RECOVERED_RUNS = "agentflow.recovery.runs";

    private final MeterRegistry registry;
    private final AtomicInteger activeRuns = new AtomicInteger(0);

    public AgentFlowMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(AGENT_RUNS_ACTIVE, activeRuns, AtomicInteger::get)
            .description("Agent runs executing in this process")
            .register(registry);
    }

    // ========== Pipeline Engine ==========

    public void transitionAttempted(TransitionTrigger trigger, String result) {
        Counter.builder(TRANSITIONS)
            .tag("trigger", trigger.value())
            .tag("result", result)
            .description("Transition attempts")
            .register(registry)
            .increment();
    }

    public void guardRejected(String guard) {
        Counter.builder(GUARD_REJECTIONS)
            .tag("guard", guard)
            .description("Guard evaluations that blocked a transition")
            .register(registry)
            .increment();
    }

    public void hookFailed(String hook, HookPolicy policy) {
        Counter.builder(HOOK_FAILURES)
            .tag("hook", hook)
            .tag("policy", policy.value())
            .description("Hook executions that failed after commit")
            .register(registry)
            .increment();
    }

    // ========== Agent Runs ==========

    public void runStarted(String agentType) {
        Counter.builder(AGENT_RUNS_STARTED)
            .tag("agent_type", agentType)
            .description("Agent runs started")
            .register(registry)
            .increment();
        activeRuns.incrementAndGet();
    }

    public void runFinished(String agentType, AgentRunStatus status, Duration duration) {
        Counter.builder(AGENT_RUNS_FINISHED)
            .tag("agent_type", agentType)
            .tag("status", status.value())
            .description("Agent runs reaching a terminal state")
            .register(registry)
            .increment();
        if (duration != null) {
            Timer.builder(AGENT_RUN_DURATION)
                .tag("agent_type", agentType)
                .tag("status", status.value())
                .description("Agent run wall-clock duration")
                .register(registry)
                .record(duration);
        }
    }

    public void backgroundRunExited() {
        activeRuns.decrementAndGet();
    }

    public int getActiveRuns() {
        return activeRuns.get();
    }

    // ========== Supervisor / Recovery ==========

    public void supervisorTimeout(String reason) {
        Counter.builder(SUPERVISOR_TIMEOUTS)
            .tag("reason", reason)
            .description("Runs terminated by the supervisor")
            .register(registry)
            .increment();
    }

    public void runRecovered() {
        Counter.builder(RECOVERED_RUNS)
            .description("Runs reconciled by startup recovery")
            .register(registry)
            .increment();
    }
}
