package io.clawdos.core.queue;

import io.clawdos.core.executor.ExecutorClient;
import java.io.IOException;

public final class RunRequestCommand implements RequestCommand {
    private final ExecutorClient executor;
    private final int tailChars;

    public RunRequestCommand(ExecutorClient executor, int tailChars) {
        this.executor = executor;
        this.tailChars = tailChars;
    }

    @Override
    public CommandQueue queue() {
        return CommandQueue.RUN;
    }

    @Override
    public RequestOutcome execute(CommandRequest request) throws IOException {
        return RequestOutcome.of(request.jobId(), executor.runJob(request.jobId()), tailChars);
    }
}
