package io.clawdos.core.executor;

import java.io.IOException;

/**
 * The Executor exited cleanly but printed something that is not a valid job list.
 */
public final class ExecutorOutputException extends IOException {

    public ExecutorOutputException(String message) {
        super(message);
    }

    public ExecutorOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
