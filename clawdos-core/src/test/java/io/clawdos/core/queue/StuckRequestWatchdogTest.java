package io.clawdos.core.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.clawdos.core.observability.ActivityEvent;
import io.clawdos.core.observability.ActivityLog;
import io.clawdos.core.store.SqliteStore;
import io.clawdos.core.testing.MutableClock;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StuckRequestWatchdogTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private SqliteStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new SqliteStore(tempDir.resolve("cron-mirror.db"), "front-office", clock);
    }

    @Test
    void shouldFailRequestsQueuedPastCutoffAndRecordActivity() throws Exception {
        String stuck = store.enqueue(CommandQueue.RUN, "job-a", null);
        clock.advance(Duration.ofSeconds(30));
        String fresh = store.enqueue(CommandQueue.DELETE, "job-b", null);
        clock.advance(Duration.ofMinutes(2));

        int failed = watchdog(store).sweepOnce();

        assertThat(failed).isEqualTo(1);
        CommandRequest request = store.find(CommandQueue.RUN, stuck).orElseThrow();
        assertThat(request.status()).isEqualTo(RequestStatus.ERROR);
        assertThat(request.result())
            .containsEntry("ref", "job-a")
            .containsEntry("error", "Request stuck in queued > 120s; marking as error so UI can recover.")
            .containsEntry("requestedAt", "2026-03-01T10:00:00Z")
            .containsEntry("detectedAt", "2026-03-01T10:02:30Z")
            .containsEntry("executorBin", "/opt/homebrew/bin/openclaw");
        assertThat(store.find(CommandQueue.DELETE, fresh).orElseThrow().status()).isEqualTo(RequestStatus.QUEUED);

        List<ActivityEvent> activities = store.recent(5);
        assertThat(activities).hasSize(1);
        assertThat(activities.get(0).type()).isEqualTo("watchdog");
        assertThat(activities.get(0).actorAgentKey()).isEqualTo("agent:cron-mirror");
        assertThat(activities.get(0).message()).contains("cron_run_requests").contains(stuck);
    }

    @Test
    void shouldLeaveRunningRequestsAlone() throws Exception {
        String id = store.enqueue(CommandQueue.PATCH, "job-a", Map.of("enabled", true));
        store.transition(CommandQueue.PATCH, id, RequestStatus.QUEUED, RequestStatus.RUNNING, null);
        clock.advance(Duration.ofHours(1));

        assertThat(watchdog(store).sweepOnce()).isZero();
        assertThat(store.find(CommandQueue.PATCH, id).orElseThrow().status()).isEqualTo(RequestStatus.RUNNING);
    }

    @Test
    void shouldStillFailRequestWhenActivityWriteFails() throws Exception {
        String id = store.enqueue(CommandQueue.RUN, "job-a", null);
        clock.advance(Duration.ofMinutes(5));
        ActivityLog broken = new ActivityLog() {
            @Override
            public void record(ActivityEvent event) throws IOException {
                throw new IOException("activities table missing");
            }

            @Override
            public List<ActivityEvent> recent(int limit) {
                return List.of();
            }
        };
        StuckRequestWatchdog watchdog = new StuckRequestWatchdog(
            store, broken, List.of(CommandQueue.values()), clock, Duration.ofMinutes(2), 25, "/opt/homebrew/bin/openclaw"
        );

        assertThat(watchdog.sweepOnce()).isEqualTo(1);
        assertThat(store.find(CommandQueue.RUN, id).orElseThrow().status()).isEqualTo(RequestStatus.ERROR);
    }

    @Test
    void shouldSweepRemainingQueuesWhenOneFails() throws Exception {
        String id = store.enqueue(CommandQueue.DELETE, "job-a", null);
        clock.advance(Duration.ofMinutes(5));
        RequestQueueStore flaky = new FailingRunQueueStore(store);
        StuckRequestWatchdog watchdog = new StuckRequestWatchdog(
            flaky, store, List.of(CommandQueue.values()), clock, Duration.ofMinutes(2), 25, "openclaw"
        );

        assertThatThrownBy(watchdog::sweepOnce).isInstanceOf(IOException.class).hasMessageContaining("run queue");
        assertThat(store.find(CommandQueue.DELETE, id).orElseThrow().status()).isEqualTo(RequestStatus.ERROR);
    }

    private StuckRequestWatchdog watchdog(SqliteStore target) {
        return new StuckRequestWatchdog(
            target,
            target,
            List.of(CommandQueue.values()),
            clock,
            Duration.ofMinutes(2),
            25,
            "/opt/homebrew/bin/openclaw"
        );
    }

    private static final class FailingRunQueueStore implements RequestQueueStore {
        private final RequestQueueStore delegate;

        FailingRunQueueStore(RequestQueueStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public List<CommandRequest> fetchQueued(CommandQueue queue, int limit) throws IOException {
            return delegate.fetchQueued(queue, limit);
        }

        @Override
        public List<CommandRequest> fetchQueuedBefore(CommandQueue queue, Instant cutoff, int limit) throws IOException {
            if (queue == CommandQueue.RUN) {
                throw new IOException("run queue unavailable");
            }
            return delegate.fetchQueuedBefore(queue, cutoff, limit);
        }

        @Override
        public boolean transition(
            CommandQueue queue,
            String requestId,
            RequestStatus from,
            RequestStatus to,
            Map<String, Object> result
        ) throws IOException {
            return delegate.transition(queue, requestId, from, to, result);
        }

        @Override
        public String enqueue(CommandQueue queue, String jobId, Map<String, Object> patch) throws IOException {
            return delegate.enqueue(queue, jobId, patch);
        }

        @Override
        public Optional<CommandRequest> find(CommandQueue queue, String requestId) throws IOException {
            return delegate.find(queue, requestId);
        }
    }
}
