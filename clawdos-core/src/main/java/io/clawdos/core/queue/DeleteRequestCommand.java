package io.clawdos.core.queue;

import io.clawdos.core.executor.CommandResult;
import io.clawdos.core.executor.ExecutorClient;
import java.io.IOException;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@code cron rm}. A job the Executor no longer knows counts as removed, so the mirror never keeps a
 * ghost row that cannot be deleted.
 */
public final class DeleteRequestCommand implements RequestCommand {
    private static final Pattern MISSING = Pattern.compile("not\\s+found|no\\s+such", Pattern.CASE_INSENSITIVE);

    private final ExecutorClient executor;
    private final int tailChars;

    public DeleteRequestCommand(ExecutorClient executor, int tailChars) {
        this.executor = executor;
        this.tailChars = tailChars;
    }

    @Override
    public CommandQueue queue() {
        return CommandQueue.DELETE;
    }

    @Override
    public RequestOutcome execute(CommandRequest request) throws IOException {
        CommandResult command = executor.removeJob(request.jobId());
        Map<String, Object> result = RequestOutcome.payload(request.jobId(), command, tailChars);
        boolean looksMissing = !command.timedOut()
            && (MISSING.matcher(command.stderrTail(tailChars)).find()
                || MISSING.matcher(command.stdoutTail(tailChars)).find());
        boolean removed = command.succeeded() || looksMissing;
        result.put("removed", removed);
        return new RequestOutcome(removed, result);
    }
}
