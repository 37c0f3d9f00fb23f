package io.clawdos.core.mirror;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.clawdos.core.executor.ExecutorJob;
import io.clawdos.core.executor.Schedule;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Change detector for the Executor job list. Not a cryptographic hash: a collision only delays a
 * mirror update until the next observable change.
 */
public final class Fingerprints {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 0x01000193;

    private Fingerprints() {
    }

    /**
     * Hashes the id-sorted projection {@code {id, name, enabled, schedule, nextRunAtMs, lastRunAtMs,
     * lastStatus}} of every job, so the Executor's listing order does not matter.
     */
    public static String of(List<ExecutorJob> jobs) {
        ArrayNode projection = JSON.createArrayNode();
        jobs.stream()
            .sorted(Comparator.comparing(ExecutorJob::id))
            .map(Fingerprints::project)
            .forEach(projection::add);
        try {
            return Integer.toHexString(fnv1a32(JSON.writeValueAsString(projection)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job projection", e);
        }
    }

    /**
     * 32-bit FNV-1a over UTF-16 code units.
     */
    public static int fnv1a32(String value) {
        int hash = FNV_OFFSET_BASIS;
        for (int i = 0; i < value.length(); i++) {
            hash ^= value.charAt(i);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    private static ObjectNode project(ExecutorJob job) {
        ObjectNode node = JSON.createObjectNode();
        node.put("id", job.id());
        if (job.name() != null) {
            node.put("name", job.name());
        }
        node.put("enabled", job.enabled());
        if (job.schedule() != null) {
            node.set("schedule", scheduleNode(job.schedule()));
        }
        if (job.nextRunAtMs() != null) {
            node.put("nextRunAtMs", job.nextRunAtMs());
        }
        if (job.lastRunAtMs() != null) {
            node.put("lastRunAtMs", job.lastRunAtMs());
        }
        if (job.lastStatus() != null) {
            node.put("lastStatus", job.lastStatus());
        }
        return node;
    }

    private static JsonNode scheduleNode(Schedule schedule) {
        if (schedule instanceof Schedule.Cron cron) {
            ObjectNode node = JSON.createObjectNode().put("kind", cron.kind()).put("expr", cron.expr());
            if (cron.tz() != null) {
                node.put("tz", cron.tz());
            }
            return node;
        }
        if (schedule instanceof Schedule.Every every) {
            return JSON.createObjectNode().put("kind", every.kind()).put("everyMs", every.everyMs());
        }
        Schedule.Other other = (Schedule.Other) schedule;
        return other.raw() == null ? JSON.createObjectNode().put("kind", other.kind()) : sortedFields(other.raw());
    }

    // Unknown schedule kinds are hashed with keys sorted, so the Executor's key order never matters.
    private static JsonNode sortedFields(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode sorted = JSON.createObjectNode();
            for (String name : names) {
                sorted.set(name, sortedFields(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = JSON.createArrayNode();
            node.forEach(element -> array.add(sortedFields(element)));
            return array;
        }
        return node;
    }
}
