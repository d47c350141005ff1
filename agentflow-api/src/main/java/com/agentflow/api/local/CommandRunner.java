package com.agentflow.api.local;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs CLI tools (git, gh) as child processes.
 */
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    private final Duration timeout;

    public CommandRunner(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Run a command and return its stdout.
     *
     * @throws CommandFailedException on a non-zero exit, a timeout or a start failure;
     *         the message carries stderr
     */
    public String exec(Path workDir, String... command) {
        List<String> commandLine = List.of(command);
        log.debug("Running: {} in {}", String.join(" ", commandLine), workDir);

        Process process;
        try {
            process = new ProcessBuilder(commandLine)
                .directory(workDir.toFile())
                .redirectErrorStream(false)
                .start();
        } catch (IOException e) {
            throw new CommandFailedException("Failed to start " + command[0] + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> read(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CommandFailedException(String.join(" ", commandLine) + " timed out after " + timeout, -1);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String error = stderr.get().trim();
                throw new CommandFailedException(
                    error.isEmpty() ? String.join(" ", commandLine) + " exited with code " + exitCode : error,
                    exitCode);
            }
            return stdout.get();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CommandFailedException("Interrupted while running " + command[0], e);
        } catch (ExecutionException e) {
            throw new CommandFailedException("Failed to read output of " + command[0], e.getCause());
        }
    }

    private static String read(InputStream stream) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
