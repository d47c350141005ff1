package com.agentflow.api.local;

import com.agentflow.core.exception.ScmException;
import com.agentflow.core.spi.GitOperations;

import java.nio.file.Path;

/**
 * {@link GitOperations} over the git CLI.
 */
public class GitCliOperations implements GitOperations {

    private final CommandRunner runner;

    public GitCliOperations(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public String diff(String workdir, String baseBranch) {
        try {
            return runner.exec(Path.of(workdir), "git", "diff", baseBranch);
        } catch (CommandFailedException e) {
            throw new ScmException("git diff against " + baseBranch + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void push(String workdir, String branch) {
        try {
            runner.exec(Path.of(workdir), "git", "push", "-u", "origin", branch);
        } catch (CommandFailedException e) {
            throw new ScmException("git push of " + branch + " failed: " + e.getMessage(), e);
        }
    }
}
