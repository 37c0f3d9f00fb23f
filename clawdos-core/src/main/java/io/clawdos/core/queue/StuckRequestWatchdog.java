package io.clawdos.core.queue;

import io.clawdos.core.observability.ActivityEvent;
import io.clawdos.core.observability.ActivityLog;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fails requests that were never claimed. Only rows still {@code queued} past the cutoff are touched;
 * a {@code running} row belongs to its drain loop.
 */
public final class StuckRequestWatchdog {
    private static final Logger LOG = LoggerFactory.getLogger(StuckRequestWatchdog.class);
    static final String ACTOR = "agent:cron-mirror";
    static final String ACTIVITY_TYPE = "watchdog";

    private final RequestQueueStore store;
    private final ActivityLog activityLog;
    private final List<CommandQueue> queues;
    private final Clock clock;
    private final Duration stuckAfter;
    private final int batchSize;
    private final String executorBin;

    public StuckRequestWatchdog(
        RequestQueueStore store,
        ActivityLog activityLog,
        List<CommandQueue> queues,
        Clock clock,
        Duration stuckAfter,
        int batchSize,
        String executorBin
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.activityLog = Objects.requireNonNull(activityLog, "activityLog must not be null");
        this.queues = List.copyOf(queues);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.stuckAfter = Objects.requireNonNull(stuckAfter, "stuckAfter must not be null");
        this.batchSize = batchSize;
        this.executorBin = executorBin == null ? "" : executorBin;
    }

    /**
     * Sweeps every queue. A store failure on one queue does not stop the others; the first one is
     * rethrown once all queues were visited.
     *
     * @return requests moved to {@code error}
     */
    public int sweepOnce() throws IOException {
        int failed = 0;
        IOException firstFailure = null;
        for (CommandQueue queue : queues) {
            try {
                failed += sweep(queue);
            } catch (IOException e) {
                LOG.warn("Watchdog sweep of {} failed: {}", queue.table(), e.getMessage());
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
        return failed;
    }

    private int sweep(CommandQueue queue) throws IOException {
        Instant now = clock.instant();
        Instant cutoff = now.minus(stuckAfter);
        List<CommandRequest> stuck = store.fetchQueuedBefore(queue, cutoff, batchSize);
        int failed = 0;

        for (CommandRequest request : stuck) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("ref", request.jobId());
            result.put("error", "Request stuck in queued > " + stuckAfter.toSeconds()
                + "s; marking as error so UI can recover.");
            result.put("requestedAt", request.requestedAt() == null ? null : request.requestedAt().toString());
            result.put("detectedAt", now.toString());
            result.put("executorBin", executorBin);

            if (!store.transition(queue, request.id(), RequestStatus.QUEUED, RequestStatus.ERROR, result)) {
                LOG.debug("Request {} in {} left queued before the watchdog reached it", request.id(), queue.table());
                continue;
            }
            failed++;
            LOG.warn("Marked stuck {} request {} (job {}) as error", queue.table(), request.id(), request.jobId());
            recordActivity(queue, request);
        }
        return failed;
    }

    private void recordActivity(CommandQueue queue, CommandRequest request) {
        try {
            activityLog.record(new ActivityEvent(
                ACTIVITY_TYPE,
                "[cron-mirror] Marked stuck " + queue.table() + " request as error (ref "
                    + request.jobId() + ", req " + request.id() + ").",
                ACTOR
            ));
        } catch (IOException | RuntimeException e) {
            LOG.debug("Failed to record watchdog activity: {}", e.getMessage());
        }
    }
}
