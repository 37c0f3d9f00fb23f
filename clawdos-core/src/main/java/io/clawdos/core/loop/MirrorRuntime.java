package io.clawdos.core.loop;

import io.clawdos.core.config.model.MirrorConfig;
import io.clawdos.core.executor.CommandRunner;
import io.clawdos.core.executor.ExecutorClient;
import io.clawdos.core.executor.ProcessCommandRunner;
import io.clawdos.core.mirror.CronMirrorService;
import io.clawdos.core.mirror.MirrorRowMapper;
import io.clawdos.core.queue.CommandQueue;
import io.clawdos.core.queue.DeleteRequestCommand;
import io.clawdos.core.queue.PatchRequestCommand;
import io.clawdos.core.queue.QueueDrainer;
import io.clawdos.core.queue.RunRequestCommand;
import io.clawdos.core.queue.StuckRequestWatchdog;
import io.clawdos.core.store.CronMirrorStore;
import io.clawdos.core.store.MirrorStores;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the loops need, wired from one validated configuration.
 */
public final class MirrorRuntime {
    private final MirrorConfig config;
    private final Clock clock;
    private final CronMirrorStore store;
    private final ExecutorClient executor;
    private final CronMirrorService mirrorService;
    private final Map<CommandQueue, QueueDrainer> drainers;
    private final StuckRequestWatchdog watchdog;

    public MirrorRuntime(MirrorConfig config, CronMirrorStore store, CommandRunner runner, Clock clock) {
        this.config = config.validate();
        this.clock = clock;
        this.store = store;
        this.executor = new ExecutorClient(config.executor(), runner);
        this.mirrorService = new CronMirrorService(
            executor,
            store,
            new MirrorRowMapper(config.projectId(), config.limits().instructionsMaxChars())
        );

        int tail = config.limits().outputTailChars();
        int batch = config.limits().drainBatchSize();
        this.drainers = new EnumMap<>(CommandQueue.class);
        drainers.put(CommandQueue.RUN, new QueueDrainer(store, new RunRequestCommand(executor, tail), batch));
        drainers.put(CommandQueue.DELETE, new QueueDrainer(store, new DeleteRequestCommand(executor, tail), batch));
        drainers.put(CommandQueue.PATCH, new QueueDrainer(store, new PatchRequestCommand(executor, tail), batch));

        this.watchdog = new StuckRequestWatchdog(
            store,
            store,
            List.of(CommandQueue.values()),
            clock,
            config.loops().stuckAfter(),
            config.limits().watchdogBatchSize(),
            executor.bin()
        );
    }

    /**
     * Validates {@code config} and opens its store with a real subprocess runner.
     */
    public static MirrorRuntime open(MirrorConfig config, Clock clock) throws IOException {
        config.validate();
        return new MirrorRuntime(config, MirrorStores.open(config, clock), new ProcessCommandRunner(), clock);
    }

    public MirrorConfig config() {
        return config;
    }

    public CronMirrorStore store() {
        return store;
    }

    public CronMirrorService mirrorService() {
        return mirrorService;
    }

    public QueueDrainer drainer(CommandQueue queue) {
        return drainers.get(queue);
    }

    public StuckRequestWatchdog watchdog() {
        return watchdog;
    }

    public CronMirrorDaemon daemon() {
        return new CronMirrorDaemon(
            mirrorService,
            new ArrayList<>(drainers.values()),
            watchdog,
            config.loops(),
            clock
        );
    }
}
