package io.clawdos.core.executor;

import java.io.IOException;

/**
 * The Executor exited non-zero or was killed on timeout.
 */
public final class ExecutorCommandException extends IOException {
    private final CommandResult result;

    public ExecutorCommandException(String message, CommandResult result) {
        super(message);
        this.result = result;
    }

    public CommandResult result() {
        return result;
    }
}
