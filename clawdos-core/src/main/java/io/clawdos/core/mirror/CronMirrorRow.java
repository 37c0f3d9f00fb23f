package io.clawdos.core.mirror;

import java.time.Instant;

/**
 * One {@code cron_mirror} row. Keyed by {@code (projectId, jobId)}.
 */
public record CronMirrorRow(
    String projectId,
    String jobId,
    String name,
    String scheduleKind,
    String scheduleExpr,
    String tz,
    boolean enabled,
    Instant nextRunAt,
    Instant lastRunAt,
    String lastStatus,
    Long lastDurationMs,
    String instructions,
    String targetAgentKey
) {
    public static final String SENTINEL_JOB_ID = "__mirror_state__";
    public static final String SENTINEL_KIND = "state";

    /**
     * The reserved row whose {@code scheduleExpr} holds the last mirrored fingerprint.
     */
    public static CronMirrorRow sentinel(String projectId, String fingerprint) {
        return new CronMirrorRow(
            projectId,
            SENTINEL_JOB_ID,
            "mirror state (do not delete)",
            SENTINEL_KIND,
            fingerprint,
            null,
            false,
            null,
            null,
            null,
            null,
            null,
            null
        );
    }

    public boolean sentinelRow() {
        return SENTINEL_JOB_ID.equals(jobId);
    }
}
