package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Guard reference declared on a transition.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransitionGuard(
    @JsonProperty("name") GuardKind kind,
    Map<String, Object> params
) {
    public TransitionGuard {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static TransitionGuard of(GuardKind kind) {
        return new TransitionGuard(kind, Map.of());
    }
}
