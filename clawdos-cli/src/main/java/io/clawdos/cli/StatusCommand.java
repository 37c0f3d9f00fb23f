package io.clawdos.cli;

import io.clawdos.core.config.model.MirrorConfig;
import io.clawdos.core.loop.MirrorRuntime;
import io.clawdos.core.mirror.CronMirrorRow;
import io.clawdos.core.observability.ActivityEvent;
import io.clawdos.core.queue.CommandQueue;
import io.clawdos.core.store.CronMirrorStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show configuration and mirror status")
public final class StatusCommand implements Callable<Integer> {
    private static final int QUEUE_PEEK = 100;

    private final CliContext context;

    @Option(names = "--config", description = "Config file path")
    Path config;

    @Option(names = "--show-config", description = "Print the effective configuration, secrets masked")
    boolean showConfig;

    @Option(names = "--jobs", description = "List the mirrored jobs")
    boolean jobs;

    @Option(names = "--activity", paramLabel = "N", description = "Show the N most recent activity events")
    int activity;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Path path = context.resolveConfigPath(config);
        try {
            MirrorConfig loaded = context.configService().load(path);
            System.out.println("Config path: " + path);
            System.out.println("Config exists: " + Files.exists(path));
            System.out.println("Project: " + loaded.projectId());
            System.out.println("Executor: " + loaded.executor().bin());
            System.out.println("Store backend: " + loaded.store().normalizedBackend());
            System.out.println("Store configured: " + loaded.store().configured());
            if (showConfig) {
                System.out.println(context.configService().toPrettyJson(loaded));
            }
            if (!loaded.store().configured()) {
                return 0;
            }

            MirrorRuntime runtime = context.runtimeFactory().open(loaded.validate());
            CronMirrorStore store = runtime.store();
            System.out.println("Mirror fingerprint: " + store.loadFingerprint().orElse("(none)"));
            System.out.println("Mirrored jobs: " + store.mirroredJobIds().size());
            for (CommandQueue queue : CommandQueue.values()) {
                int queued = store.fetchQueued(queue, QUEUE_PEEK).size();
                System.out.println("Queued " + queue.table() + ": " + (queued >= QUEUE_PEEK ? QUEUE_PEEK + "+" : queued));
            }
            if (jobs) {
                for (CronMirrorRow row : store.listJobs()) {
                    System.out.println("  " + describe(row));
                }
            }
            if (activity > 0) {
                System.out.println("Recent activity:");
                for (ActivityEvent event : store.recent(activity)) {
                    System.out.println("  [" + event.type() + "] " + event.actorAgentKey() + ": " + event.message());
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String describe(CronMirrorRow row) {
        String schedule = row.scheduleKind() == null
            ? "-"
            : row.scheduleKind() + (row.scheduleExpr() == null ? "" : " " + row.scheduleExpr());
        return row.jobId() + " \"" + row.name() + "\" " + schedule
            + (row.enabled() ? "" : " (disabled)")
            + (row.lastStatus() == null ? "" : " last=" + row.lastStatus());
    }
}
