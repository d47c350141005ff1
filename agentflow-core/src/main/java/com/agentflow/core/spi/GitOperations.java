package com.agentflow.core.spi;

/**
 * Narrow git surface used by artifact collection.
 */
public interface GitOperations {

    /**
     * Diff of the working directory against a base branch.
     */
    String diff(String workdir, String baseBranch);

    void push(String workdir, String branch);
}
