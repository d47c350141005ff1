package com.agentflow.api.local;

import com.agentflow.core.exception.ScmException;
import com.agentflow.core.spi.PullRequest;
import com.agentflow.core.spi.PullRequestRequest;
import com.agentflow.core.spi.PullRequestStatus;
import com.agentflow.core.spi.ScmPlatform;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub pull requests through the {@code gh} CLI.
 */
public class GhCliScmPlatform implements ScmPlatform {

    private static final Logger log = LoggerFactory.getLogger(GhCliScmPlatform.class);
    private static final Pattern PR_NUMBER = Pattern.compile("/pull/(\\d+)");

    private final CommandRunner runner;
    private final Path repository;
    private final ObjectMapper objectMapper;

    public GhCliScmPlatform(CommandRunner runner, Path repository, ObjectMapper objectMapper) {
        this.runner = runner;
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public PullRequest createPullRequest(PullRequestRequest request) {
        Path workdir = request.workdir() != null ? Path.of(request.workdir()) : repository;
        String output;
        try {
            output = runner.exec(workdir, "gh", "pr", "create",
                "--title", request.title(),
                "--body", request.body() != null ? request.body() : "",
                "--head", request.head(),
                "--base", request.base());
        } catch (CommandFailedException e) {
            throw new ScmException("gh pr create failed: " + e.getMessage(), e);
        }

        // gh prints the new pull request's URL last
        String[] lines = output.trim().split("\n");
        String url = lines[lines.length - 1].trim();
        log.info("Created pull request {}", url);
        return new PullRequest(url, numberOf(url));
    }

    @Override
    public void mergePullRequest(String url) {
        try {
            runner.exec(repository, "gh", "pr", "merge", String.valueOf(numberOf(url)), "--squash", "--delete-branch");
        } catch (CommandFailedException e) {
            throw new ScmException("gh pr merge of " + url + " failed: " + e.getMessage(), e);
        }
        log.info("Merged pull request {}", url);
    }

    @Override
    public PullRequestStatus getPullRequestStatus(String url) {
        try {
            String output = runner.exec(repository, "gh", "pr", "view", String.valueOf(numberOf(url)), "--json", "state");
            JsonNode state = objectMapper.readTree(output).path("state");
            return PullRequestStatus.fromValue(state.asText().toLowerCase());
        } catch (CommandFailedException e) {
            throw new ScmException("gh pr view of " + url + " failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ScmException("Unreadable gh pr view output for " + url, e);
        }
    }

    static int numberOf(String url) {
        Matcher matcher = PR_NUMBER.matcher(url);
        if (!matcher.find()) {
            throw new ScmException("Not a pull request URL: " + url);
        }
        return Integer.parseInt(matcher.group(1));
    }
}
