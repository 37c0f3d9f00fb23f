package io.clawdos.core.loop;

import io.clawdos.core.config.model.LoopsConfig;
import io.clawdos.core.mirror.CronMirrorService;
import io.clawdos.core.mirror.MirrorResult;
import io.clawdos.core.queue.CommandQueue;
import io.clawdos.core.queue.QueueDrainer;
import io.clawdos.core.queue.StuckRequestWatchdog;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the mirror, drain and watchdog loops on independent timers.
 *
 * <p>The mirror loop re-arms itself after every cycle with the delay from its {@link Backoff}, so a
 * failing Executor or store is polled less often. The other loops use fixed delays.
 */
public final class CronMirrorDaemon implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CronMirrorDaemon.class);

    private final ScheduledLoop mirrorLoop;
    private final List<QueueDrainer> drainers;
    private final StuckRequestWatchdog watchdog;
    private final LoopsConfig loops;
    private final Backoff backoff;
    private final LivenessTracker liveness;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    public CronMirrorDaemon(
        CronMirrorService mirrorService,
        List<QueueDrainer> drainers,
        StuckRequestWatchdog watchdog,
        LoopsConfig loops,
        Clock clock
    ) {
        this(mirrorService, drainers, watchdog, loops, clock,
            Executors.newScheduledThreadPool(drainers.size() + 3, new LoopThreadFactory()));
    }

    CronMirrorDaemon(
        CronMirrorService mirrorService,
        List<QueueDrainer> drainers,
        StuckRequestWatchdog watchdog,
        LoopsConfig loops,
        Clock clock,
        ScheduledExecutorService scheduler
    ) {
        Objects.requireNonNull(mirrorService, "mirrorService must not be null");
        this.mirrorLoop = new ScheduledLoop("mirror", () -> {
            MirrorResult result = mirrorService.mirrorOnce();
            return result.changed() ? result.jobCount() : 0;
        });
        this.drainers = List.copyOf(drainers);
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog must not be null");
        this.loops = Objects.requireNonNull(loops, "loops must not be null");
        this.backoff = new Backoff(loops.mirrorInterval(), loops.mirrorMaxBackoff());
        this.liveness = new LivenessTracker(clock);
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("daemon already started");
        }
        scheduler.schedule(this::mirrorAndReschedule, 0, TimeUnit.MILLISECONDS);

        List<ScheduledLoop> fixed = new ArrayList<>();
        for (QueueDrainer drainer : drainers) {
            ScheduledLoop loop = new ScheduledLoop(drainer.queue().table(), drainer::drainOnce);
            schedule(loop, drainInterval(drainer.queue()));
            fixed.add(loop);
        }
        ScheduledLoop watchdogLoop = new ScheduledLoop("watchdog", watchdog::sweepOnce);
        schedule(watchdogLoop, loops.watchdogInterval());
        fixed.add(watchdogLoop);

        long heartbeat = loops.heartbeatInterval().toMillis();
        scheduler.scheduleWithFixedDelay(
            () -> LOG.info("cron-mirror alive {}", liveness.describe()),
            heartbeat,
            heartbeat,
            TimeUnit.MILLISECONDS
        );
        LOG.info("cron-mirror started: mirror every {}s (max {}s), {} loop(s) on fixed delays",
            loops.mirrorInterval().toSeconds(), loops.mirrorMaxBackoff().toSeconds(), fixed.size());
    }

    /**
     * Runs one mirror cycle and updates the backoff.
     *
     * @return delay before the next cycle
     */
    Duration runMirrorCycle() {
        TickOutcome outcome = mirrorLoop.tick();
        if (outcome == TickOutcome.SUCCEEDED) {
            liveness.markMirrorOk();
            return backoff.recordSuccess();
        }
        if (outcome == TickOutcome.FAILED) {
            Duration next = backoff.recordFailure();
            LOG.warn("Mirror cycle failed; next attempt in {}s", next.toSeconds());
            return next;
        }
        return backoff.current();
    }

    public LivenessTracker liveness() {
        return liveness;
    }

    public Backoff backoff() {
        return backoff;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Loops did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("cron-mirror stopped {}", liveness.describe());
    }

    private void mirrorAndReschedule() {
        Duration next = backoff.current();
        try {
            next = runMirrorCycle();
        } catch (Error e) {
            next = backoff.recordFailure();
            LOG.error("Mirror cycle aborted; next attempt in {}s", next.toSeconds(), e);
            throw e;
        } finally {
            rearmMirror(next);
        }
    }

    private void rearmMirror(Duration delay) {
        if (closed.get()) {
            return;
        }
        try {
            scheduler.schedule(this::mirrorAndReschedule, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Scheduler shut down; mirror loop not re-armed");
        }
    }

    private void schedule(ScheduledLoop loop, Duration interval) {
        long delay = interval.toMillis();
        scheduler.scheduleWithFixedDelay(loop::tick, delay, delay, TimeUnit.MILLISECONDS);
    }

    private Duration drainInterval(CommandQueue queue) {
        return switch (queue) {
            case RUN -> loops.runDrainInterval();
            case DELETE -> loops.deleteDrainInterval();
            case PATCH -> loops.patchDrainInterval();
        };
    }

    private static final class LoopThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "cron-mirror-loop-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
