package io.clawdos.core.loop;

public enum TickOutcome {
    SKIPPED,
    SUCCEEDED,
    FAILED
}
