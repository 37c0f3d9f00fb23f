package io.clawdos.cli;

import io.clawdos.core.config.ConfigException;
import io.clawdos.core.loop.MirrorRuntime;
import io.clawdos.core.queue.CommandQueue;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "drain", description = "Drain queued run/delete/patch requests once and exit")
public final class DrainCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--config", description = "Config file path")
    Path config;

    @Option(
        names = "--queue",
        description = "Queue to drain: ${COMPLETION-CANDIDATES}. Repeatable, all queues when omitted",
        split = ","
    )
    List<CommandQueue> queues;

    @Option(names = "--watchdog", description = "Also fail requests stuck in queued")
    boolean watchdog;

    public DrainCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MirrorRuntime runtime = context.runtimeFactory().open(context.loadValidated(config));
            List<CommandQueue> targets = queues == null || queues.isEmpty() ? List.of(CommandQueue.values()) : queues;
            if (watchdog) {
                System.out.println("Watchdog failed " + runtime.watchdog().sweepOnce() + " stuck request(s)");
            }
            for (CommandQueue queue : targets) {
                int processed = runtime.drainer(queue).drainOnce();
                System.out.println(queue.table() + ": processed " + processed);
            }
            return 0;
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Drain failed: " + e.getMessage());
            return 1;
        }
    }
}
