package io.clawdos.cli;

import io.clawdos.core.config.ConfigService;
import io.clawdos.core.config.model.MirrorConfig;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    RuntimeFactory runtimeFactory,
    DaemonRunner daemonRunner
) {
    public Path resolveConfigPath(Path override) {
        return override == null ? configPath : override;
    }

    /**
     * Loads the layered configuration and rejects it before anything is opened.
     */
    public MirrorConfig loadValidated(Path override) throws IOException {
        return configService.load(resolveConfigPath(override)).validate();
    }
}
