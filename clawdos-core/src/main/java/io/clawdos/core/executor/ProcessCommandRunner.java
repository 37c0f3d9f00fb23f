package io.clawdos.core.executor;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one subprocess per call. Output goes to temp files so a chatty child can never block on a
 * full pipe while we wait for it.
 */
public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessCommandRunner.class);
    static final int START_FAILURE_EXIT_CODE = 127;
    static final int TIMEOUT_EXIT_CODE = 1;

    @Override
    public CommandResult run(List<String> command, Duration timeout) throws IOException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command is required");
        }
        Path stdoutFile = Files.createTempFile("cron-mirror-", ".out");
        Path stderrFile = Files.createTempFile("cron-mirror-", ".err");
        long started = System.nanoTime();
        try {
            Process process;
            try {
                process = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile())
                    .start();
            } catch (IOException e) {
                LOG.warn("Failed to start {}: {}", command.get(0), e.getMessage());
                return new CommandResult(
                    START_FAILURE_EXIT_CODE,
                    "",
                    "failed to start " + command.get(0) + ": " + e.getMessage(),
                    elapsedMs(started),
                    false
                );
            }

            process.getOutputStream().close();
            boolean finished = waitFor(process, timeout);
            if (!finished) {
                process.destroyForcibly();
                waitQuietly(process);
                return new CommandResult(
                    TIMEOUT_EXIT_CODE,
                    "",
                    "[cron-mirror] timeout after " + timeout.toMillis() + "ms",
                    elapsedMs(started),
                    true
                );
            }

            return new CommandResult(
                process.exitValue(),
                readLeniently(stdoutFile),
                readLeniently(stderrFile),
                elapsedMs(started),
                false
            );
        } finally {
            Files.deleteIfExists(stdoutFile);
            Files.deleteIfExists(stderrFile);
        }
    }

    private boolean waitFor(Process process, Duration timeout) throws IOException {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for executor command");
        }
    }

    private void waitQuietly(Process process) throws IOException {
        try {
            process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while killing executor command");
        }
    }

    // Malformed bytes become U+FFFD; job logs are not guaranteed to be valid UTF-8.
    private static String readLeniently(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
