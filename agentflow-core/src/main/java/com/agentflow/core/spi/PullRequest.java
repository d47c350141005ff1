package com.agentflow.core.spi;

public record PullRequest(String url, int number) {
}
