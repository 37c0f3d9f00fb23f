package io.clawdos.core.observability;

public record ActivityEvent(
    String type,
    String message,
    String actorAgentKey
) {
    public ActivityEvent {
        type = type == null ? "" : type.trim();
        message = message == null ? "" : message;
        actorAgentKey = actorAgentKey == null ? "" : actorAgentKey.trim();
    }
}
