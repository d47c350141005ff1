package com.agentflow.engine.outcome;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON shape expected for an outcome payload field.
 */
public enum PayloadType {
    STRING,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    public boolean matches(JsonNode value) {
        if (value == null) {
            return false;
        }
        return switch (this) {
            case STRING -> value.isTextual();
            case NUMBER -> value.isNumber();
            case BOOLEAN -> value.isBoolean();
            case ARRAY -> value.isArray();
            case OBJECT -> value.isObject();
        };
    }

    public String label() {
        return name().toLowerCase();
    }
}
