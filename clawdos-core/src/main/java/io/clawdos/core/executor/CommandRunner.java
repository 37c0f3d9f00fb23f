package io.clawdos.core.executor;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

@FunctionalInterface
public interface CommandRunner {
    CommandResult run(List<String> command, Duration timeout) throws IOException;
}
