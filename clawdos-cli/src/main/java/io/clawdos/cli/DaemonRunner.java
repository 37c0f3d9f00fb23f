package io.clawdos.cli;

import io.clawdos.core.loop.CronMirrorDaemon;

@FunctionalInterface
public interface DaemonRunner {

    /**
     * Starts {@code daemon} and blocks until the process is asked to stop.
     *
     * @return process exit code
     */
    int run(CronMirrorDaemon daemon) throws Exception;
}
