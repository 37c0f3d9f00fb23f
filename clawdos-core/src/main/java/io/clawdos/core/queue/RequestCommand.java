package io.clawdos.core.queue;

import java.io.IOException;

/**
 * The Executor call behind one command queue.
 */
public interface RequestCommand {
    CommandQueue queue();

    RequestOutcome execute(CommandRequest request) throws IOException;
}
