package io.clawdos.core.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.clawdos.core.config.model.ExecutorConfig;
import io.clawdos.core.testing.FakeCommandRunner;
import io.clawdos.core.testing.Jobs;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExecutorClientTest {

    private final ExecutorConfig config = new ExecutorConfig("/usr/local/bin/openclaw", 20, 600, 60, 60);

    @Test
    void shouldListJobsWithAllAndJsonFlags() throws Exception {
        FakeCommandRunner runner = FakeCommandRunner.listing(Jobs.listing(Jobs.cronJob("a", "* * * * *", "ok")));
        ExecutorClient client = new ExecutorClient(config, runner);

        List<ExecutorJob> jobs = client.listJobs();

        assertThat(jobs).extracting(ExecutorJob::id).containsExactly("a");
        assertThat(runner.lastCommand()).containsExactly("/usr/local/bin/openclaw", "cron", "list", "--all", "--json");
        assertThat(runner.timeouts()).containsExactly(Duration.ofSeconds(20));
    }

    @Test
    void shouldFailListingOnNonZeroExitOrTimeout() {
        FakeCommandRunner runner = new FakeCommandRunner(c -> FakeCommandRunner.exit(2, "", "gateway unreachable"));
        ExecutorClient client = new ExecutorClient(config, runner);

        assertThatThrownBy(client::listJobs)
            .isInstanceOf(ExecutorCommandException.class)
            .hasMessageContaining("gateway unreachable");

        runner.answer(c -> FakeCommandRunner.timedOut(20_000));
        assertThatThrownBy(client::listJobs)
            .isInstanceOf(ExecutorCommandException.class)
            .hasMessageContaining("timed out");
    }

    @Test
    void shouldBuildRunRemoveAndEditCommands() throws Exception {
        FakeCommandRunner runner = FakeCommandRunner.listing("");
        ExecutorClient client = new ExecutorClient(config, runner);

        client.runJob("job-1");
        client.removeJob("job-2");
        client.editJob("job-3", new JobPatch(null, null, null, null, true));

        assertThat(runner.commands()).containsExactly(
            List.of("/usr/local/bin/openclaw", "cron", "run", "job-1", "--force"),
            List.of("/usr/local/bin/openclaw", "cron", "rm", "job-2"),
            List.of("/usr/local/bin/openclaw", "cron", "edit", "job-3", "--enable")
        );
        assertThat(runner.timeouts()).containsExactly(
            Duration.ofMinutes(10),
            Duration.ofSeconds(60),
            Duration.ofSeconds(60)
        );
    }
}
