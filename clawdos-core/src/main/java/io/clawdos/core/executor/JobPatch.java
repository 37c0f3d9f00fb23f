package io.clawdos.core.executor;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Edit request for one job, as submitted in {@code patch_json}. Null fields are left untouched.
 */
public record JobPatch(
    String name,
    String instructions,
    String scheduleKind,
    String scheduleExpr,
    Boolean enabled
) {

    public static JobPatch fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new JobPatch(null, null, null, null, null);
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("patch must be a JSON object");
        }
        JsonNode enabled = node.path("enabled");
        return new JobPatch(
            textOrNull(node.path("name")),
            textOrNull(node.path("instructions")),
            textOrNull(node.path("scheduleKind")),
            textOrNull(node.path("scheduleExpr")),
            enabled.isBoolean() ? enabled.asBoolean() : null
        );
    }

    /**
     * Flags appended after {@code cron edit <jobId>}.
     */
    public List<String> toArgs() {
        List<String> args = new ArrayList<>();
        if (name != null && !name.isBlank()) {
            args.add("--name");
            args.add(name.trim());
        }
        if (instructions != null) {
            args.add("--system-event");
            args.add(instructions);
        }
        if (scheduleExpr != null && !scheduleExpr.isBlank()) {
            args.add("every".equals(scheduleKind) ? "--every" : "--cron");
            args.add(scheduleExpr.trim());
        }
        if (Boolean.TRUE.equals(enabled)) {
            args.add("--enable");
        } else if (Boolean.FALSE.equals(enabled)) {
            args.add("--disable");
        }
        return args;
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }
}
