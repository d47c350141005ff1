package com.agentflow.engine.outcome;

import java.util.Map;

/**
 * Expected payload of an agent outcome. A definition without fields is a
 * signal-only outcome whose payload is not checked.
 *
 * @param name           outcome name reported by agents
 * @param description    human readable meaning
 * @param requiredFields required payload fields and their types, in check order
 */
public record OutcomeDefinition(String name, String description, Map<String, PayloadType> requiredFields) {

    public OutcomeDefinition {
        requiredFields = requiredFields == null ? Map.of() : requiredFields;
    }

    public static OutcomeDefinition signal(String name, String description) {
        return new OutcomeDefinition(name, description, Map.of());
    }

    public boolean isSignalOnly() {
        return requiredFields.isEmpty();
    }
}
