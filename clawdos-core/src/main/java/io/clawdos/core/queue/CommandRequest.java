package io.clawdos.core.queue;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Map;

/**
 * One row of a command queue table. {@code patch} is only set for {@link CommandQueue#PATCH}.
 */
public record CommandRequest(
    String id,
    String jobId,
    RequestStatus status,
    Instant requestedAt,
    JsonNode patch,
    Map<String, Object> result
) {
    public CommandRequest {
        result = result == null ? Map.of() : result;
    }
}
