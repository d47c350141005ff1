package com.agentflow.engine.agent;

import java.time.Duration;
import java.util.Map;

/**
 * Tunables of the agent execution service.
 *
 * @param outputFlushInterval how often buffered agent output is written to the run
 * @param branchPrefix        prefix of workspace branches, followed by task id and mode
 * @param baseBranch          branch diffs and pull requests are taken against
 * @param defaultRunTimeout   run timeout for agent types without an override
 * @param runTimeouts         per agent type timeout overrides
 */
public record AgentRuntimeSettings(
    Duration outputFlushInterval,
    String branchPrefix,
    String baseBranch,
    Duration defaultRunTimeout,
    Map<String, Duration> runTimeouts
) {
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(3);
    public static final Duration DEFAULT_RUN_TIMEOUT = Duration.ofMinutes(15);

    public AgentRuntimeSettings {
        outputFlushInterval = outputFlushInterval != null ? outputFlushInterval : DEFAULT_FLUSH_INTERVAL;
        branchPrefix = branchPrefix != null ? branchPrefix : "task/";
        baseBranch = baseBranch != null ? baseBranch : "main";
        defaultRunTimeout = defaultRunTimeout != null ? defaultRunTimeout : DEFAULT_RUN_TIMEOUT;
        runTimeouts = runTimeouts == null ? Map.of() : Map.copyOf(runTimeouts);
    }

    public static AgentRuntimeSettings defaults() {
        return new AgentRuntimeSettings(null, null, null, null, null);
    }

    public Duration timeoutFor(String agentType) {
        return runTimeouts.getOrDefault(agentType, defaultRunTimeout);
    }

    public String branchFor(String taskId, String mode) {
        return branchPrefix + taskId + "/" + mode;
    }
}
