package io.clawdos.cli;

import picocli.CommandLine.Command;

@Command(
    name = "cron-mirror",
    mixinStandardHelpOptions = true,
    description = "Mirror executor cron jobs into the dashboard store and drain its command queues"
)
public final class CronMirrorCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
