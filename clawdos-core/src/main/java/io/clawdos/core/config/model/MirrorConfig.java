package io.clawdos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.clawdos.core.config.ConfigException;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MirrorConfig(
    String projectId,
    ExecutorConfig executor,
    StoreConfig store,
    LoopsConfig loops,
    LimitsConfig limits
) {

    public static MirrorConfig defaults() {
        return new MirrorConfig(
            "front-office",
            ExecutorConfig.defaults(),
            StoreConfig.defaults(),
            LoopsConfig.defaults(),
            LimitsConfig.defaults()
        );
    }

    /**
     * Checks everything the daemon needs before any loop starts.
     *
     * @throws ConfigException naming the first missing or invalid setting
     */
    public MirrorConfig validate() {
        if (projectId == null || projectId.isBlank()) {
            throw new ConfigException("projectId is required");
        }
        if (executor.bin() == null || executor.bin().isBlank()) {
            throw new ConfigException("executor.bin is required");
        }
        store.validate();
        loops.validate();
        limits.validate();
        return this;
    }
}
