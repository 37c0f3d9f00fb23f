package io.clawdos.core.loop;

@FunctionalInterface
public interface LoopTask {

    /**
     * @return items handled in this cycle, only used for logging
     */
    int runCycle() throws Exception;
}
