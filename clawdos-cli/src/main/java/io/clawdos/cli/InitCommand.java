package io.clawdos.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Write a config file with defaults, or refresh an existing one")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--config", description = "Config file path")
    Path config;

    @Option(names = "--overwrite", description = "Overwrite existing config with defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Path path = context.resolveConfigPath(config);
        try {
            boolean created = context.configService().init(path, overwrite);
            if (created) {
                System.out.println("Created config: " + path);
            } else if (overwrite) {
                System.out.println("Overwrote config with defaults: " + path);
            } else {
                System.out.println("Refreshed config with new defaults: " + path);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }
    }
}
