package com.agentflow.engine.agent;

import com.agentflow.core.spi.AgentCapability;
import com.agentflow.core.spi.AgentConfig;
import com.agentflow.core.spi.AgentContext;
import com.agentflow.core.spi.AgentResult;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Agent capability driven by a replaceable script instead of a model.
 * Used for local runs without an agent backend and for tests.
 */
public class ScriptedAgentCapability implements AgentCapability {

    public static final String TYPE = "scripted";

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final String type;
    private final Set<String> stopRequests = ConcurrentHashMap.newKeySet();
    private volatile AgentScript script;
    private volatile List<String> outputChunks = List.of();

    public ScriptedAgentCapability(AgentScript script) {
        this(TYPE, script);
    }

    public ScriptedAgentCapability(String type, AgentScript script) {
        this.type = type;
        this.script = script;
    }

    @Override
    public String type() {
        return type;
    }

    public void setScript(AgentScript script) {
        this.script = script;
    }

    /**
     * Chunks streamed to the output consumer before the script runs.
     */
    public void setOutputChunks(List<String> chunks) {
        this.outputChunks = List.copyOf(chunks);
    }

    @Override
    public AgentResult execute(AgentContext context, AgentConfig config, Consumer<String> onOutput) {
        if (onOutput != null) {
            for (String chunk : outputChunks) {
                onOutput.accept(chunk);
            }
        }
        return script.run(context, config);
    }

    @Override
    public void stop(String runId) {
        stopRequests.add(runId);
    }

    /**
     * Scripts that simulate long work poll this to honor {@link #stop}.
     */
    public boolean isStopRequested(String runId) {
        return stopRequests.contains(runId);
    }

    @FunctionalInterface
    public interface AgentScript {
        AgentResult run(AgentContext context, AgentConfig config);
    }

    // ========== Canned Scripts ==========

    public static AgentResult happyPlan(AgentContext context, AgentConfig config) {
        ObjectNode payload = JSON.objectNode();
        payload.put("plan", "1. step1\n2. step2\n3. step3");
        payload.putArray("subtasks").add("step1").add("step2").add("step3");
        return AgentResult.success("Plan generated successfully", "plan_complete", payload);
    }

    public static AgentResult happyImplement(AgentContext context, AgentConfig config) {
        ObjectNode payload = JSON.objectNode();
        payload.put("filesChanged", 3);
        return AgentResult.success("Implementation complete", "pr_ready", payload);
    }

    public static AgentResult happyReview(AgentContext context, AgentConfig config) {
        return AgentResult.success("Review approved", "approved", null);
    }

    public static AgentResult humanInTheLoop(AgentContext context, AgentConfig config) {
        ObjectNode payload = JSON.objectNode();
        payload.putArray("questions").add("What is the expected behavior?").add("What environment?");
        return AgentResult.success("Need more information", "needs_info", payload);
    }

    /**
     * Succeeds until the n-th invocation, which fails.
     */
    public static AgentScript failAfterSteps(int n) {
        AtomicInteger calls = new AtomicInteger();
        return (context, config) -> {
            int call = calls.incrementAndGet();
            if (call >= n) {
                return AgentResult.failure(1, "Failed after " + n + " steps", "Simulated failure after " + n + " steps");
            }
            return AgentResult.success("Step " + call + " ok", "step_complete", null);
        };
    }

    /**
     * Picks a canned script from the run's mode.
     */
    public static AgentResult byMode(AgentContext context, AgentConfig config) {
        return switch (context.mode()) {
            case "plan", "plan_revision", "investigate" -> happyPlan(context, config);
            case "implement", "request_changes" -> happyImplement(context, config);
            default -> happyReview(context, config);
        };
    }
}
