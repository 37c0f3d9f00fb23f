package io.clawdos.core.loop;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One periodic loop with a single-flight guard: a tick that arrives while the previous cycle is
 * still running is skipped, never queued behind it.
 *
 * <p>A failing cycle is logged and reported as {@link TickOutcome#FAILED}; it never escapes into
 * the scheduler, so one loop cannot cancel another.
 */
public final class ScheduledLoop {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduledLoop.class);

    private final String name;
    private final LoopTask task;
    private final AtomicReference<LoopState> state = new AtomicReference<>(LoopState.IDLE);
    private volatile Exception lastFailure;

    public ScheduledLoop(String name, LoopTask task) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.task = Objects.requireNonNull(task, "task must not be null");
    }

    public String name() {
        return name;
    }

    public LoopState state() {
        return state.get();
    }

    public Exception lastFailure() {
        return lastFailure;
    }

    public TickOutcome tick() {
        if (!state.compareAndSet(LoopState.IDLE, LoopState.RUNNING)) {
            LOG.debug("{} still running; skipping tick", name);
            return TickOutcome.SKIPPED;
        }
        try {
            int handled = task.runCycle();
            lastFailure = null;
            if (handled > 0) {
                LOG.debug("{} handled {} item(s)", name, handled);
            }
            return TickOutcome.SUCCEEDED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lastFailure = e;
            LOG.warn("{} interrupted", name);
            return TickOutcome.FAILED;
        } catch (Exception e) {
            lastFailure = e;
            LOG.warn("{} failed: {}", name, e.getMessage(), e);
            return TickOutcome.FAILED;
        } finally {
            state.set(LoopState.IDLE);
        }
    }
}
