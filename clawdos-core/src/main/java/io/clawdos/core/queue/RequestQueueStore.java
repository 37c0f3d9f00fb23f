package io.clawdos.core.queue;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The command queue tables of one project.
 */
public interface RequestQueueStore {

    /**
     * Oldest {@code queued} rows first.
     */
    List<CommandRequest> fetchQueued(CommandQueue queue, int limit) throws IOException;

    /**
     * {@code queued} rows requested strictly before {@code cutoff}, oldest first.
     */
    List<CommandRequest> fetchQueuedBefore(CommandQueue queue, Instant cutoff, int limit) throws IOException;

    /**
     * Moves a row from {@code from} to {@code to} only if it is still in {@code from}.
     *
     * @param result payload to store with the new status, or {@code null} to leave it untouched
     * @return whether this call performed the transition
     */
    boolean transition(
        CommandQueue queue,
        String requestId,
        RequestStatus from,
        RequestStatus to,
        Map<String, Object> result
    ) throws IOException;

    /**
     * Inserts a new {@code queued} row, as the control API does for the dashboard.
     *
     * @return id of the new row
     */
    String enqueue(CommandQueue queue, String jobId, Map<String, Object> patch) throws IOException;

    Optional<CommandRequest> find(CommandQueue queue, String requestId) throws IOException;
}
