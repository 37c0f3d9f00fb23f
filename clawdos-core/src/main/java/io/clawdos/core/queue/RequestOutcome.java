package io.clawdos.core.queue;

import io.clawdos.core.executor.CommandResult;
import java.util.LinkedHashMap;
import java.util.Map;

public record RequestOutcome(boolean success, Map<String, Object> result) {

    public RequestOutcome {
        result = result == null ? Map.of() : result;
    }

    /**
     * Result payload {@code {jobId, exitCode, durationMs, stdoutTail, stderrTail}}, plus {@code timedOut}
     * when the Executor was killed.
     */
    public static Map<String, Object> payload(String jobId, CommandResult command, int tailChars) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("jobId", jobId);
        result.put("exitCode", command.exitCode());
        result.put("durationMs", command.durationMs());
        result.put("stdoutTail", command.stdoutTail(tailChars));
        result.put("stderrTail", command.stderrTail(tailChars));
        if (command.timedOut()) {
            result.put("timedOut", true);
        }
        return result;
    }

    public static RequestOutcome of(String jobId, CommandResult command, int tailChars) {
        return new RequestOutcome(command.succeeded(), payload(jobId, command, tailChars));
    }

    public static RequestOutcome failure(String jobId, String error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("jobId", jobId);
        result.put("error", error);
        return new RequestOutcome(false, result);
    }
}
