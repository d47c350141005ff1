package com.agentflow.core.spi;

public record PullRequestRequest(
    String workdir,
    String title,
    String body,
    String head,
    String base
) {
}
