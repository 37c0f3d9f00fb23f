package io.clawdos.core.loop;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay before the next mirror cycle. Doubles after each failure up to {@code max}, back to
 * {@code base} after a success.
 */
public final class Backoff {
    private final Duration base;
    private final Duration max;
    private Duration current;

    public Backoff(Duration base, Duration max) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.max = Objects.requireNonNull(max, "max must not be null");
        if (base.isZero() || base.isNegative()) {
            throw new IllegalArgumentException("base must be > 0");
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max must be >= base");
        }
        this.current = base;
    }

    public synchronized Duration current() {
        return current;
    }

    public synchronized Duration recordSuccess() {
        current = base;
        return current;
    }

    public synchronized Duration recordFailure() {
        Duration doubled = current.multipliedBy(2);
        current = doubled.compareTo(max) > 0 ? max : doubled;
        return current;
    }
}
