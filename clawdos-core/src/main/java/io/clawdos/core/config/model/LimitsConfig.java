package io.clawdos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LimitsConfig(
    int instructionsMaxChars,
    int outputTailChars,
    int drainBatchSize,
    int watchdogBatchSize
) {

    public static LimitsConfig defaults() {
        return new LimitsConfig(2_000, 4_000, 5, 25);
    }

    void validate() {
        LoopsConfig.positive("limits.instructionsMaxChars", instructionsMaxChars);
        LoopsConfig.positive("limits.outputTailChars", outputTailChars);
        LoopsConfig.positive("limits.drainBatchSize", drainBatchSize);
        LoopsConfig.positive("limits.watchdogBatchSize", watchdogBatchSize);
    }
}
