package com.agentflow.api.local;

import com.agentflow.core.exception.WorkspaceException;
import com.agentflow.core.spi.Workspace;
import com.agentflow.core.spi.WorkspaceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * One git worktree per task under a common root, branched from the base branch.
 * Locks are git worktree locks, so {@code git worktree prune} skips running tasks.
 */
public class GitWorktreeWorkspaceProvider implements WorkspaceProvider {

    private static final Logger log = LoggerFactory.getLogger(GitWorktreeWorkspaceProvider.class);

    private final CommandRunner runner;
    private final Path repository;
    private final Path root;
    private final String baseBranch;

    public GitWorktreeWorkspaceProvider(CommandRunner runner, Path repository, Path root, String baseBranch) {
        this.runner = runner;
        this.repository = repository.toAbsolutePath().normalize();
        this.root = root.isAbsolute() ? root.normalize() : this.repository.resolve(root).normalize();
        this.baseBranch = baseBranch;
    }

    @Override
    public Optional<Workspace> get(String taskId) {
        Path path = pathOf(taskId);
        if (!Files.isDirectory(path)) {
            return Optional.empty();
        }
        try {
            String branch = runner.exec(path, "git", "rev-parse", "--abbrev-ref", "HEAD").trim();
            return Optional.of(new Workspace(path.toString(), branch));
        } catch (CommandFailedException e) {
            throw new WorkspaceException("Failed to read workspace of task " + taskId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Workspace create(String branchName, String taskId) {
        Path path = pathOf(taskId);
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new WorkspaceException("Cannot create workspace root " + root + ": " + e.getMessage(), e);
        }

        log.info("Adding worktree for task {} at {} (branch: {})", taskId, path, branchName);
        try {
            runner.exec(repository, "git", "worktree", "add", "-b", branchName, path.toString(), baseBranch);
        } catch (CommandFailedException e) {
            // Branch left over from an earlier run
            log.debug("worktree add -b failed for {}, reusing branch: {}", branchName, e.getMessage());
            try {
                runner.exec(repository, "git", "worktree", "add", path.toString(), branchName);
            } catch (CommandFailedException retry) {
                throw new WorkspaceException("Failed to create worktree for task " + taskId + ": " + retry.getMessage(), retry);
            }
        }
        return new Workspace(path.toString(), branchName);
    }

    @Override
    public void lock(String taskId) {
        try {
            runner.exec(repository, "git", "worktree", "lock", "--reason", "agentflow run", pathOf(taskId).toString());
        } catch (CommandFailedException e) {
            if (!e.getMessage().contains("already locked")) {
                throw new WorkspaceException("Failed to lock workspace of task " + taskId + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public void unlock(String taskId) {
        try {
            runner.exec(repository, "git", "worktree", "unlock", pathOf(taskId).toString());
        } catch (CommandFailedException e) {
            if (!e.getMessage().contains("not locked")) {
                throw new WorkspaceException("Failed to unlock workspace of task " + taskId + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public boolean isLocked(String taskId) {
        String listing;
        try {
            listing = runner.exec(repository, "git", "worktree", "list", "--porcelain");
        } catch (CommandFailedException e) {
            throw new WorkspaceException("Failed to list worktrees: " + e.getMessage(), e);
        }
        return isLockedIn(listing, pathOf(taskId));
    }

    /**
     * Porcelain output is one block per worktree, blocks separated by a blank line.
     */
    static boolean isLockedIn(String porcelain, Path path) {
        for (String block : porcelain.split("\n\n")) {
            boolean matches = false;
            boolean locked = false;
            for (String line : block.split("\n")) {
                if (line.startsWith("worktree ")) {
                    matches = Path.of(line.substring("worktree ".length())).normalize().equals(path);
                } else if (line.equals("locked") || line.startsWith("locked ")) {
                    locked = true;
                }
            }
            if (matches) {
                return locked;
            }
        }
        return false;
    }

    Path pathOf(String taskId) {
        return root.resolve(taskId);
    }
}
