package io.clawdos.core.queue;

import io.clawdos.core.executor.ExecutorClient;
import io.clawdos.core.executor.JobPatch;
import java.io.IOException;

public final class PatchRequestCommand implements RequestCommand {
    private final ExecutorClient executor;
    private final int tailChars;

    public PatchRequestCommand(ExecutorClient executor, int tailChars) {
        this.executor = executor;
        this.tailChars = tailChars;
    }

    @Override
    public CommandQueue queue() {
        return CommandQueue.PATCH;
    }

    @Override
    public RequestOutcome execute(CommandRequest request) throws IOException {
        JobPatch patch;
        try {
            patch = JobPatch.fromJson(request.patch());
        } catch (IllegalArgumentException e) {
            return RequestOutcome.failure(request.jobId(), "invalid patch: " + e.getMessage());
        }
        return RequestOutcome.of(request.jobId(), executor.editJob(request.jobId(), patch), tailChars);
    }
}
