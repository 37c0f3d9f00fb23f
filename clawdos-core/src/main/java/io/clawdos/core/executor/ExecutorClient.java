package io.clawdos.core.executor;

import io.clawdos.core.config.model.ExecutorConfig;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The {@code cron} subcommands of the external automation daemon.
 */
public final class ExecutorClient {
    private final ExecutorConfig config;
    private final CommandRunner runner;
    private final ExecutorJobParser parser;

    public ExecutorClient(ExecutorConfig config, CommandRunner runner) {
        this(config, runner, new ExecutorJobParser());
    }

    public ExecutorClient(ExecutorConfig config, CommandRunner runner, ExecutorJobParser parser) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    public String bin() {
        return config.bin();
    }

    /**
     * {@code cron list --all --json}.
     *
     * @throws ExecutorCommandException on non-zero exit or timeout
     * @throws ExecutorOutputException when the output is not a valid job list
     */
    public List<ExecutorJob> listJobs() throws IOException {
        CommandResult result = runner.run(command("cron", "list", "--all", "--json"), config.listTimeout());
        if (result.timedOut()) {
            throw new ExecutorCommandException(
                "executor cron list timed out after " + config.listTimeout().toMillis() + "ms",
                result
            );
        }
        if (result.exitCode() != 0) {
            String detail = result.stderr().isBlank() ? result.stdout() : result.stderr();
            throw new ExecutorCommandException("executor cron list failed: " + detail.trim(), result);
        }
        return parser.parse(result.stdout());
    }

    public CommandResult runJob(String jobId) throws IOException {
        return runner.run(command("cron", "run", jobId, "--force"), config.runTimeout());
    }

    public CommandResult removeJob(String jobId) throws IOException {
        return runner.run(command("cron", "rm", jobId), config.deleteTimeout());
    }

    public CommandResult editJob(String jobId, JobPatch patch) throws IOException {
        List<String> args = new ArrayList<>(List.of("cron", "edit", jobId));
        args.addAll(patch.toArgs());
        return runner.run(command(args.toArray(String[]::new)), config.patchTimeout());
    }

    private List<String> command(String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add(config.bin());
        command.addAll(List.of(args));
        return command;
    }
}
