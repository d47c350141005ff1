package com.agentflow.core.model;

/**
 * One step of a task plan.
 */
public record Subtask(String name, SubtaskStatus status) {

    public static Subtask open(String name) {
        return new Subtask(name, SubtaskStatus.OPEN);
    }
}
