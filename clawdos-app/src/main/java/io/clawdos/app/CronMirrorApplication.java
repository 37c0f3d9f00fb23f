package io.clawdos.app;

import io.clawdos.cli.CliContext;
import io.clawdos.cli.CronMirrorCliCommand;
import io.clawdos.cli.DrainCommand;
import io.clawdos.cli.EnqueueCommand;
import io.clawdos.cli.InitCommand;
import io.clawdos.cli.RunCommand;
import io.clawdos.cli.StatusCommand;
import io.clawdos.cli.SyncCommand;
import io.clawdos.core.config.ConfigPaths;
import io.clawdos.core.config.ConfigService;
import io.clawdos.core.loop.CronMirrorDaemon;
import io.clawdos.core.loop.MirrorRuntime;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import picocli.CommandLine;

public final class CronMirrorApplication {

    private CronMirrorApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        CliContext context = new CliContext(
            configService,
            ConfigPaths.defaultConfigPath(),
            config -> MirrorRuntime.open(config, Clock.systemUTC()),
            CronMirrorApplication::runUntilShutdown
        );

        CommandLine commandLine = new CommandLine(new CronMirrorCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("sync", new SyncCommand(context));
        commandLine.addSubcommand("drain", new DrainCommand(context));
        commandLine.addSubcommand("enqueue", new EnqueueCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runUntilShutdown(CronMirrorDaemon daemon) throws InterruptedException {
        CountDownLatch shutdown = new CountDownLatch(1);
        // The JVM halts once hooks return, so the hook itself waits for in-flight requests to be written.
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            daemon.close();
            shutdown.countDown();
        }, "cron-mirror-shutdown"));
        try (daemon) {
            daemon.start();
            shutdown.await();
        }
        return 0;
    }
}
