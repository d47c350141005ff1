package com.agentflow.core.spi;

/**
 * Hosted source-control platform (pull requests).
 */
public interface ScmPlatform {

    PullRequest createPullRequest(PullRequestRequest request);

    void mergePullRequest(String url);

    PullRequestStatus getPullRequestStatus(String url);
}
