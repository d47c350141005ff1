package com.agentflow.core.spi;

/**
 * Isolated working directory and branch for a task.
 */
public record Workspace(String path, String branch) {
}
