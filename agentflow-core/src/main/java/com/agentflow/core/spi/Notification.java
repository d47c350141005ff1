package com.agentflow.core.spi;

public record Notification(String taskId, String title, String body, String channel) {
}
