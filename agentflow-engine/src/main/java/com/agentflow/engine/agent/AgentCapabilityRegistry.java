package com.agentflow.engine.agent;

import com.agentflow.core.exception.AgentExecutionException;
import com.agentflow.core.spi.AgentCapability;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent capabilities by agent type.
 */
public class AgentCapabilityRegistry {

    private final Map<String, AgentCapability> capabilities = new ConcurrentHashMap<>();

    public AgentCapabilityRegistry register(AgentCapability capability) {
        capabilities.put(capability.type(), capability);
        return this;
    }

    /**
     * @throws AgentExecutionException if no capability serves the type
     */
    public AgentCapability get(String agentType) {
        AgentCapability capability = agentType != null ? capabilities.get(agentType) : null;
        if (capability == null) {
            throw new AgentExecutionException("Unknown agent type: " + agentType);
        }
        return capability;
    }

    public Set<String> types() {
        return Set.copyOf(capabilities.keySet());
    }
}
