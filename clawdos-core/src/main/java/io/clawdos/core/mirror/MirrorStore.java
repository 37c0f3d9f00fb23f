package io.clawdos.core.mirror;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The {@code cron_mirror} table of one project.
 */
public interface MirrorStore {
    Optional<String> loadFingerprint() throws IOException;

    void upsertJobs(List<CronMirrorRow> rows) throws IOException;

    void saveFingerprint(String fingerprint) throws IOException;

    /**
     * Job ids currently mirrored, sentinel excluded.
     */
    Set<String> mirroredJobIds() throws IOException;

    /**
     * Deletes job rows whose id is not in {@code keepJobIds}. The sentinel row is always kept.
     *
     * @return rows deleted
     */
    int deleteJobsNotIn(Set<String> keepJobIds) throws IOException;

    List<CronMirrorRow> listJobs() throws IOException;
}
