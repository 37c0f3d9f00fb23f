package io.clawdos.core.loop;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ScheduledLoopTest {

    @Test
    void shouldSkipTickWhilePreviousCycleRuns() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger cycles = new AtomicInteger();
        ScheduledLoop loop = new ScheduledLoop("cron_run_requests", () -> {
            cycles.incrementAndGet();
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return 1;
        });

        CompletableFuture<TickOutcome> first = CompletableFuture.supplyAsync(loop::tick);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(loop.state()).isEqualTo(LoopState.RUNNING);
        assertThat(loop.tick()).isEqualTo(TickOutcome.SKIPPED);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(TickOutcome.SUCCEEDED);
        assertThat(loop.state()).isEqualTo(LoopState.IDLE);
        assertThat(cycles.get()).isEqualTo(1);
    }

    @Test
    void shouldContainFailuresAndAcceptNextTick() {
        AtomicInteger calls = new AtomicInteger();
        ScheduledLoop loop = new ScheduledLoop("mirror", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IOException("store down");
            }
            return 0;
        });

        assertThat(loop.tick()).isEqualTo(TickOutcome.FAILED);
        assertThat(loop.lastFailure()).hasMessage("store down");
        assertThat(loop.state()).isEqualTo(LoopState.IDLE);

        assertThat(loop.tick()).isEqualTo(TickOutcome.SUCCEEDED);
        assertThat(loop.lastFailure()).isNull();
    }
}
