package io.clawdos.core.store;

import io.clawdos.core.mirror.MirrorStore;
import io.clawdos.core.observability.ActivityLog;
import io.clawdos.core.queue.RequestQueueStore;

/**
 * Every table the daemon touches, behind one backend.
 */
public interface CronMirrorStore extends MirrorStore, RequestQueueStore, ActivityLog {
}
