package io.clawdos.core.observability;

import java.io.IOException;
import java.util.List;

/**
 * Append-only {@code activities} table shown in the dashboard feed.
 */
public interface ActivityLog {
    void record(ActivityEvent event) throws IOException;

    List<ActivityEvent> recent(int limit) throws IOException;
}
