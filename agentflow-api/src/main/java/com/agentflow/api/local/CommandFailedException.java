package com.agentflow.api.local;

/**
 * A local command exited non-zero, timed out, or could not be started.
 */
public class CommandFailedException extends RuntimeException {

    private final int exitCode;

    public CommandFailedException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public CommandFailedException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public int getExitCode() {
        return exitCode;
    }
}
