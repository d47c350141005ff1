package com.agentflow.engine.hook;

import com.agentflow.core.exception.PipelineConfigException;
import com.agentflow.core.model.HookKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed hook lookup. {@code start_agent} is registered after the agent
 * service exists, so registration may happen after construction.
 */
public class HookRegistry {

    private final Map<HookKind, HookFunction> hooks = Collections.synchronizedMap(new EnumMap<>(HookKind.class));

    public HookRegistry register(HookKind kind, HookFunction hook) {
        hooks.put(kind, hook);
        return this;
    }

    public boolean isRegistered(HookKind kind) {
        return hooks.containsKey(kind);
    }

    /**
     * @throws PipelineConfigException if no function is registered for the kind
     */
    public HookFunction get(HookKind kind) {
        HookFunction hook = hooks.get(kind);
        if (hook == null) {
            throw new PipelineConfigException("hooks", "hook '" + kind.hookName() + "' is not registered");
        }
        return hook;
    }

    public Set<HookKind> registeredKinds() {
        synchronized (hooks) {
            return Set.copyOf(hooks.keySet());
        }
    }
}
