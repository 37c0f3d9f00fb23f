package io.clawdos.core.loop;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;

public final class LivenessTracker {
    private final Clock clock;
    private final Instant startedAt;
    private volatile Instant lastMirrorOk;

    public LivenessTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.startedAt = clock.instant();
    }

    public void markMirrorOk() {
        lastMirrorOk = clock.instant();
    }

    /**
     * Empty until the first successful mirror cycle.
     */
    public OptionalLong lastMirrorOkSecondsAgo() {
        Instant last = lastMirrorOk;
        if (last == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Duration.between(last, clock.instant()).toSeconds());
    }

    public long uptimeSeconds() {
        return Duration.between(startedAt, clock.instant()).toSeconds();
    }

    public String describe() {
        OptionalLong ago = lastMirrorOkSecondsAgo();
        return "uptimeSeconds=" + uptimeSeconds()
            + " lastMirrorOkSecondsAgo=" + (ago.isPresent() ? Long.toString(ago.getAsLong()) : "never");
    }
}
