package io.clawdos.cli;

import io.clawdos.core.config.ConfigException;
import io.clawdos.core.config.model.MirrorConfig;
import io.clawdos.core.loop.MirrorRuntime;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "run", description = "Run the mirror, drain and watchdog loops until stopped")
public final class RunCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    private final CliContext context;

    @Option(names = "--config", description = "Config file path")
    Path config;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        MirrorConfig loaded;
        try {
            loaded = context.loadValidated(config);
        } catch (ConfigException e) {
            System.err.println("[cron-mirror] " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("[cron-mirror] Failed to load config: " + e.getMessage());
            return 1;
        }

        try {
            MirrorRuntime runtime = context.runtimeFactory().open(loaded);
            LOG.info("Starting cron-mirror for project {} with executor {} and {} store",
                loaded.projectId(), loaded.executor().bin(), loaded.store().normalizedBackend());
            return context.daemonRunner().run(runtime.daemon());
        } catch (Exception e) {
            System.err.println("[cron-mirror] Startup failed: " + e.getMessage());
            return 1;
        }
    }
}
