package io.clawdos.core.testing;

/**
 * {@code cron list --json} payloads.
 */
public final class Jobs {

    private Jobs() {
    }

    public static String listing(String... jobs) {
        return "{\"jobs\":[" + String.join(",", jobs) + "]}";
    }

    public static String cronJob(String id, String expr, String lastStatus) {
        return """
            {"id":"%s","name":"job %s","enabled":true,
             "schedule":{"kind":"cron","expr":"%s","tz":"UTC"},
             "state":{"nextRunAtMs":1700000060000,"lastRunAtMs":1700000000000,"lastStatus":"%s","lastDurationMs":42},
             "payload":{"message":"do %s"}}
            """.formatted(id, id, expr, lastStatus, id);
    }
}
