package io.clawdos.cli;

import io.clawdos.core.config.ConfigException;
import io.clawdos.core.mirror.MirrorResult;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "sync", description = "Run one mirror cycle and exit")
public final class SyncCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--config", description = "Config file path")
    Path config;

    public SyncCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MirrorResult result = context.runtimeFactory()
                .open(context.loadValidated(config))
                .mirrorService()
                .mirrorOnce();
            System.out.println((result.changed() ? "Mirror updated" : "Mirror unchanged")
                + ": jobs=" + result.jobCount()
                + " fingerprint=" + result.fingerprint()
                + " pruned=" + result.prunedRows());
            return 0;
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Sync failed: " + e.getMessage());
            return 1;
        }
    }
}
