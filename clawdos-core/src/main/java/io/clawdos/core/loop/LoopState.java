package io.clawdos.core.loop;

public enum LoopState {
    IDLE,
    RUNNING
}
