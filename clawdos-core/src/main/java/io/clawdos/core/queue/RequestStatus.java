package io.clawdos.core.queue;

import java.util.Locale;

/**
 * Request lifecycle. Moves forward only: {@code queued -> running -> done|error}, plus the
 * watchdog's {@code queued -> error}. Terminal states accept no further writes.
 */
public enum RequestStatus {
    QUEUED,
    RUNNING,
    DONE,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RequestStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is required");
        }
        return RequestStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean terminal() {
        return this == DONE || this == ERROR;
    }

    public boolean canMoveTo(RequestStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == ERROR;
            case RUNNING -> next == DONE || next == ERROR;
            case DONE, ERROR -> false;
        };
    }

    public void requireMoveTo(RequestStatus next) {
        if (!canMoveTo(next)) {
            throw new IllegalStateException("illegal request transition " + wireName() + " -> " + next.wireName());
        }
    }
}
