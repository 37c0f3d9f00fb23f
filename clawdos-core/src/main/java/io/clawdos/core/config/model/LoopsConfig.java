package io.clawdos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.clawdos.core.config.ConfigException;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LoopsConfig(
    int mirrorIntervalSeconds,
    int mirrorMaxBackoffSeconds,
    int runDrainSeconds,
    int deleteDrainSeconds,
    int patchDrainSeconds,
    int watchdogSeconds,
    int stuckAfterSeconds,
    int heartbeatSeconds
) {

    public static LoopsConfig defaults() {
        return new LoopsConfig(60, 600, 10, 10, 10, 30, 120, 300);
    }

    public Duration mirrorInterval() {
        return Duration.ofSeconds(mirrorIntervalSeconds);
    }

    public Duration mirrorMaxBackoff() {
        return Duration.ofSeconds(mirrorMaxBackoffSeconds);
    }

    public Duration runDrainInterval() {
        return Duration.ofSeconds(runDrainSeconds);
    }

    public Duration deleteDrainInterval() {
        return Duration.ofSeconds(deleteDrainSeconds);
    }

    public Duration patchDrainInterval() {
        return Duration.ofSeconds(patchDrainSeconds);
    }

    public Duration watchdogInterval() {
        return Duration.ofSeconds(watchdogSeconds);
    }

    public Duration stuckAfter() {
        return Duration.ofSeconds(stuckAfterSeconds);
    }

    public Duration heartbeatInterval() {
        return Duration.ofSeconds(heartbeatSeconds);
    }

    void validate() {
        positive("loops.mirrorIntervalSeconds", mirrorIntervalSeconds);
        positive("loops.runDrainSeconds", runDrainSeconds);
        positive("loops.deleteDrainSeconds", deleteDrainSeconds);
        positive("loops.patchDrainSeconds", patchDrainSeconds);
        positive("loops.watchdogSeconds", watchdogSeconds);
        positive("loops.stuckAfterSeconds", stuckAfterSeconds);
        positive("loops.heartbeatSeconds", heartbeatSeconds);
        if (mirrorMaxBackoffSeconds < mirrorIntervalSeconds) {
            throw new ConfigException("loops.mirrorMaxBackoffSeconds must be >= loops.mirrorIntervalSeconds");
        }
    }

    static void positive(String name, int value) {
        if (value <= 0) {
            throw new ConfigException(name + " must be > 0");
        }
    }
}
