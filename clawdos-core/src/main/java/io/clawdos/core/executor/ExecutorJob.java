package io.clawdos.core.executor;

/**
 * A cron job as reported by {@code cron list}. Nullable fields were absent in the Executor output.
 */
public record ExecutorJob(
    String id,
    String name,
    boolean enabled,
    Schedule schedule,
    Long nextRunAtMs,
    Long lastRunAtMs,
    String lastStatus,
    Long lastDurationMs,
    String instructions,
    String sessionTarget
) {
}
