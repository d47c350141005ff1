package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Hook reference declared on a transition, with its execution policy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransitionHook(
    @JsonProperty("name") HookKind kind,
    Map<String, Object> params,
    HookPolicy policy
) {
    public TransitionHook {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static TransitionHook of(HookKind kind, HookPolicy policy) {
        return new TransitionHook(kind, Map.of(), policy);
    }

    /**
     * Policy to apply; hooks declared without one are best effort.
     */
    @JsonIgnore
    public HookPolicy effectivePolicy() {
        return policy != null ? policy : HookPolicy.BEST_EFFORT;
    }

    /**
     * String parameter, or null when absent.
     */
    public String param(String key) {
        Object value = params.get(key);
        return value != null ? value.toString() : null;
    }
}
