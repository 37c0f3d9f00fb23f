package io.clawdos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutorConfig(
    String bin,
    int listTimeoutSeconds,
    int runTimeoutSeconds,
    int deleteTimeoutSeconds,
    int patchTimeoutSeconds
) {

    public static ExecutorConfig defaults() {
        return new ExecutorConfig("/opt/homebrew/bin/openclaw", 20, 600, 60, 60);
    }

    public Duration listTimeout() {
        return Duration.ofSeconds(listTimeoutSeconds);
    }

    public Duration runTimeout() {
        return Duration.ofSeconds(runTimeoutSeconds);
    }

    public Duration deleteTimeout() {
        return Duration.ofSeconds(deleteTimeoutSeconds);
    }

    public Duration patchTimeout() {
        return Duration.ofSeconds(patchTimeoutSeconds);
    }
}
