package io.clawdos.cli;

import io.clawdos.core.config.model.MirrorConfig;
import io.clawdos.core.loop.MirrorRuntime;
import java.io.IOException;

@FunctionalInterface
public interface RuntimeFactory {
    MirrorRuntime open(MirrorConfig config) throws IOException;
}
