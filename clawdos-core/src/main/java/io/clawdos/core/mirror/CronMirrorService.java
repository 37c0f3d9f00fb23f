package io.clawdos.core.mirror;

import io.clawdos.core.executor.ExecutorClient;
import io.clawdos.core.executor.ExecutorJob;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One mirror cycle: list Executor jobs, and only when their fingerprint moved, rewrite the mirror.
 *
 * <p>Job rows are written before the sentinel. A crash in between leaves the old fingerprint in
 * place, so the next cycle repeats the same upsert and then records the fingerprint.
 */
public final class CronMirrorService {
    private static final Logger LOG = LoggerFactory.getLogger(CronMirrorService.class);

    private final ExecutorClient executor;
    private final MirrorStore store;
    private final MirrorRowMapper mapper;

    public CronMirrorService(ExecutorClient executor, MirrorStore store, MirrorRowMapper mapper) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * @throws IOException when the Executor call fails or the store rejects a read or an upsert;
     *     the mirror is left as it was before the failing step
     */
    public MirrorResult mirrorOnce() throws IOException {
        List<ExecutorJob> jobs = executor.listJobs();
        String fingerprint = Fingerprints.of(jobs);
        String previous = store.loadFingerprint().orElse(null);

        Set<String> liveIds = new LinkedHashSet<>();
        jobs.forEach(job -> liveIds.add(job.id()));

        if (fingerprint.equals(previous)) {
            return new MirrorResult(false, jobs.size(), fingerprint, pruneIfStale(liveIds));
        }

        List<CronMirrorRow> rows = jobs.stream().map(mapper::toRow).toList();
        if (!rows.isEmpty()) {
            store.upsertJobs(rows);
        }
        store.saveFingerprint(fingerprint);
        int pruned = prune(liveIds);
        LOG.info("Mirrored {} cron job(s), fingerprint {} -> {}, pruned {}", rows.size(), previous, fingerprint, pruned);
        return new MirrorResult(true, jobs.size(), fingerprint, pruned);
    }

    // Read first so a consistent mirror sees no writes on an unchanged cycle.
    private int pruneIfStale(Set<String> liveIds) {
        try {
            Set<String> mirrored = store.mirroredJobIds();
            if (liveIds.containsAll(mirrored)) {
                return 0;
            }
        } catch (IOException e) {
            LOG.warn("Stale mirror row check failed: {}", e.getMessage());
            return 0;
        }
        return prune(liveIds);
    }

    private int prune(Set<String> liveIds) {
        try {
            int deleted = store.deleteJobsNotIn(liveIds);
            if (deleted > 0) {
                LOG.info("Pruned {} mirror row(s) for jobs no longer on the executor", deleted);
            }
            return deleted;
        } catch (IOException e) {
            LOG.warn("Stale mirror row cleanup failed: {}", e.getMessage());
            return 0;
        }
    }
}
