package io.clawdos.core.executor;

/**
 * Outcome of one Executor invocation. When {@code timedOut} is set the child was killed and its
 * partial output discarded.
 */
public record CommandResult(
    int exitCode,
    String stdout,
    String stderr,
    long durationMs,
    boolean timedOut
) {
    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        durationMs = Math.max(0, durationMs);
    }

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }

    public String stdoutTail(int maxChars) {
        return tail(stdout, maxChars);
    }

    public String stderrTail(int maxChars) {
        return tail(stderr, maxChars);
    }

    static String tail(String value, int maxChars) {
        if (value.length() <= maxChars) {
            return value;
        }
        return value.substring(value.length() - maxChars);
    }
}
