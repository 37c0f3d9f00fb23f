package io.clawdos.core.executor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Schedule of an Executor job. {@code cron} and {@code every} are typed; any other kind is kept raw.
 */
public sealed interface Schedule permits Schedule.Cron, Schedule.Every, Schedule.Other {

    String kind();

    record Cron(String expr, String tz) implements Schedule {
        public Cron {
            tz = tz == null || tz.isBlank() ? null : tz;
        }

        @Override
        public String kind() {
            return "cron";
        }
    }

    record Every(long everyMs) implements Schedule {
        @Override
        public String kind() {
            return "every";
        }
    }

    record Other(String kind, JsonNode raw) implements Schedule {
        public Other {
            kind = kind == null ? "" : kind;
        }
    }
}
