package com.agentflow.engine.outcome;

public record PayloadValidation(boolean valid, String error) {

    static PayloadValidation ok() {
        return new PayloadValidation(true, null);
    }

    static PayloadValidation invalid(String error) {
        return new PayloadValidation(false, error);
    }
}
