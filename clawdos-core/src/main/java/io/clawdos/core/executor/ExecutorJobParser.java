package io.clawdos.core.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates {@code cron list --json} output. Accepts {@code {"jobs": [...]}} or a bare array; anything
 * else, or a job that breaks the schema, is rejected as a whole.
 */
public final class ExecutorJobParser {
    private static final int STDOUT_PREVIEW_CHARS = 500;

    private final ObjectMapper mapper;

    public ExecutorJobParser() {
        this(new ObjectMapper());
    }

    public ExecutorJobParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<ExecutorJob> parse(String stdout) throws ExecutorOutputException {
        JsonNode root;
        try {
            root = mapper.readTree(stdout == null ? "" : stdout);
        } catch (JsonProcessingException e) {
            throw new ExecutorOutputException(
                "Failed to parse executor cron list JSON: " + e.getOriginalMessage() + "\nstdout: " + preview(stdout),
                e
            );
        }

        JsonNode jobs;
        if (root != null && root.isObject() && root.path("jobs").isArray()) {
            jobs = root.get("jobs");
        } else if (root != null && root.isArray()) {
            jobs = root;
        } else {
            throw new ExecutorOutputException("Expected {\"jobs\": [...]} or an array, got: " + preview(stdout));
        }

        List<ExecutorJob> parsed = new ArrayList<>(jobs.size());
        for (int i = 0; i < jobs.size(); i++) {
            parsed.add(parseJob(jobs.get(i), i));
        }
        return parsed;
    }

    private ExecutorJob parseJob(JsonNode node, int index) throws ExecutorOutputException {
        if (!node.isObject()) {
            throw new ExecutorOutputException("job[" + index + "] is not an object");
        }
        JsonNode idNode = node.path("id");
        String id = idNode.isTextual() || idNode.isNumber() ? idNode.asText().trim() : "";
        if (id.isEmpty()) {
            throw new ExecutorOutputException("job[" + index + "] has no id");
        }

        JsonNode enabledNode = node.path("enabled");
        if (!enabledNode.isMissingNode() && !enabledNode.isNull() && !enabledNode.isBoolean()) {
            throw new ExecutorOutputException("job " + id + ": enabled must be a boolean");
        }

        JsonNode state = node.path("state");
        if (!state.isMissingNode() && !state.isNull() && !state.isObject()) {
            throw new ExecutorOutputException("job " + id + ": state must be an object");
        }

        return new ExecutorJob(
            id,
            text(node.path("name")),
            enabledNode.asBoolean(false),
            parseSchedule(node.path("schedule"), id),
            epochMs(state.path("nextRunAtMs"), id, "nextRunAtMs"),
            epochMs(state.path("lastRunAtMs"), id, "lastRunAtMs"),
            text(state.path("lastStatus")),
            epochMs(state.path("lastDurationMs"), id, "lastDurationMs"),
            text(node.path("payload").path("message")),
            text(node.path("sessionTarget"))
        );
    }

    private Schedule parseSchedule(JsonNode node, String id) throws ExecutorOutputException {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new ExecutorOutputException("job " + id + ": schedule must be an object");
        }
        String kind = text(node.path("kind"));
        if ("cron".equals(kind)) {
            String expr = text(node.path("expr"));
            if (expr == null || expr.isBlank()) {
                throw new ExecutorOutputException("job " + id + ": cron schedule has no expr");
            }
            return new Schedule.Cron(expr, text(node.path("tz")));
        }
        if ("every".equals(kind)) {
            Long everyMs = epochMs(node.path("everyMs"), id, "everyMs");
            if (everyMs == null || everyMs <= 0) {
                throw new ExecutorOutputException("job " + id + ": every schedule needs a positive everyMs");
            }
            return new Schedule.Every(everyMs);
        }
        return new Schedule.Other(kind, node.deepCopy());
    }

    private Long epochMs(JsonNode node, String id, String field) throws ExecutorOutputException {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber() || (node.isNumber() && node.canConvertToLong())) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException ignored) {
                // falls through to the schema error below
            }
        }
        throw new ExecutorOutputException("job " + id + ": " + field + " must be a number");
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private static String preview(String stdout) {
        if (stdout == null) {
            return "";
        }
        return stdout.length() <= STDOUT_PREVIEW_CHARS ? stdout : stdout.substring(0, STDOUT_PREVIEW_CHARS);
    }
}
