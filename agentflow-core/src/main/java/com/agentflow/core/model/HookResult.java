package com.agentflow.core.model;

public record HookResult(boolean success, String error) {

    public static HookResult ok() {
        return new HookResult(true, null);
    }

    public static HookResult failed(String error) {
        return new HookResult(false, error);
    }
}
