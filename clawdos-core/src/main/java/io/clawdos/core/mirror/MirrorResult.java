package io.clawdos.core.mirror;

public record MirrorResult(boolean changed, int jobCount, String fingerprint, int prunedRows) {
}
