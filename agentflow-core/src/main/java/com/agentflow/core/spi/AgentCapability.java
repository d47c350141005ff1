package com.agentflow.core.spi;

import java.util.function.Consumer;

/**
 * Opaque agent backend. Every backend is driven through this contract.
 */
public interface AgentCapability {

    /**
     * Agent type this capability serves, e.g. "scripted" or "claude-code".
     */
    String type();

    /**
     * Run the agent to completion. Blocks for the agent's whole runtime.
     *
     * @param context  Task, project, working directory and mode
     * @param config   Model and timeout
     * @param onOutput Receives output chunks while the agent runs, may be null
     * @return The agent's result; a non-zero exit code means failure
     */
    AgentResult execute(AgentContext context, AgentConfig config, Consumer<String> onOutput);

    /**
     * Ask a running invocation to stop. Cooperative; may return before the agent exits.
     */
    void stop(String runId);
}
