package io.clawdos.core.queue;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains one command queue: oldest {@code queued} rows first, strictly one at a time.
 *
 * <p>A row is claimed ({@code queued -> running}) before the Executor is invoked, and the claim is
 * conditional, so a row taken by another pass is skipped instead of executed twice.
 *
 * <p>An interrupt (daemon shutdown) ends the pass after the current row has been written as
 * {@code error}; rows not yet claimed stay {@code queued}.
 */
public final class QueueDrainer {
    private static final Logger LOG = LoggerFactory.getLogger(QueueDrainer.class);

    private final RequestQueueStore store;
    private final RequestCommand command;
    private final int batchSize;

    public QueueDrainer(RequestQueueStore store, RequestCommand command, int batchSize) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.command = Objects.requireNonNull(command, "command must not be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.batchSize = batchSize;
    }

    public CommandQueue queue() {
        return command.queue();
    }

    /**
     * @return requests brought to a terminal status in this pass
     * @throws IOException when the store fails; the current request keeps whatever status it reached
     */
    public int drainOnce() throws IOException {
        CommandQueue queue = command.queue();
        List<CommandRequest> queued = store.fetchQueued(queue, batchSize);
        int processed = 0;

        for (CommandRequest request : queued) {
            if (!store.transition(queue, request.id(), RequestStatus.QUEUED, RequestStatus.RUNNING, null)) {
                LOG.debug("Request {} in {} was claimed elsewhere; skipping", request.id(), queue.table());
                continue;
            }

            RequestOutcome outcome = execute(request);
            RequestStatus terminal = outcome.success() ? RequestStatus.DONE : RequestStatus.ERROR;
            // Cleared for the write: HTTP stores refuse to run on an interrupted thread.
            boolean interrupted = Thread.interrupted();
            try {
                if (store.transition(queue, request.id(), RequestStatus.RUNNING, terminal, outcome.result())) {
                    processed++;
                    LOG.info("{} request {} for job {} -> {}", queue.table(), request.id(), request.jobId(), terminal.wireName());
                } else {
                    LOG.warn("Request {} in {} left running before its result could be written", request.id(), queue.table());
                }
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
            if (interrupted) {
                LOG.info("{} drain interrupted; remaining requests stay queued", queue.table());
                break;
            }
        }
        return processed;
    }

    private RequestOutcome execute(CommandRequest request) {
        try {
            return command.execute(request);
        } catch (InterruptedIOException e) {
            LOG.warn("Executor invocation for request {} interrupted", request.id());
            return RequestOutcome.failure(request.jobId(), "interrupted by cron-mirror shutdown");
        } catch (IOException | RuntimeException e) {
            LOG.warn("Executor invocation for request {} failed", request.id(), e);
            return RequestOutcome.failure(request.jobId(), "executor invocation failed: " + e.getMessage());
        }
    }
}
