package com.agentflow.engine.guard;

import com.agentflow.core.exception.PipelineConfigException;
import com.agentflow.core.model.GuardKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed guard lookup. Populated while the application is wired; pipelines
 * referencing an unregistered kind are rejected when they are loaded.
 */
public class GuardRegistry {

    private final Map<GuardKind, GuardFunction> guards = Collections.synchronizedMap(new EnumMap<>(GuardKind.class));

    public GuardRegistry register(GuardKind kind, GuardFunction guard) {
        guards.put(kind, guard);
        return this;
    }

    public boolean isRegistered(GuardKind kind) {
        return guards.containsKey(kind);
    }

    /**
     * @throws PipelineConfigException if no function is registered for the kind
     */
    public GuardFunction get(GuardKind kind) {
        GuardFunction guard = guards.get(kind);
        if (guard == null) {
            throw new PipelineConfigException("guards", "guard '" + kind.guardName() + "' is not registered");
        }
        return guard;
    }

    public Set<GuardKind> registeredKinds() {
        synchronized (guards) {
            return Set.copyOf(guards.keySet());
        }
    }
}
