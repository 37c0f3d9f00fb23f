package io.clawdos.core.mirror;

import io.clawdos.core.executor.ExecutorJob;
import io.clawdos.core.executor.Schedule;
import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class MirrorRowMapper {
    static final String DEFAULT_TARGET_AGENT = "agent:main:main";
    private static final Pattern AGENT_HEADER = Pattern.compile("@agent:([a-zA-Z0-9_:-]+)");

    private final String projectId;
    private final int instructionsMaxChars;

    public MirrorRowMapper(String projectId, int instructionsMaxChars) {
        this.projectId = projectId;
        this.instructionsMaxChars = instructionsMaxChars;
    }

    public CronMirrorRow toRow(ExecutorJob job) {
        String instructions = truncate(job.instructions());
        Schedule schedule = job.schedule();
        return new CronMirrorRow(
            projectId,
            job.id(),
            job.name() == null || job.name().isBlank() ? job.id() : job.name(),
            schedule == null ? null : schedule.kind(),
            scheduleExpr(schedule),
            schedule instanceof Schedule.Cron cron ? cron.tz() : null,
            job.enabled(),
            instant(job.nextRunAtMs()),
            instant(job.lastRunAtMs()),
            job.lastStatus(),
            job.lastDurationMs(),
            instructions,
            targetAgentKey(job.sessionTarget(), instructions)
        );
    }

    private static String scheduleExpr(Schedule schedule) {
        if (schedule instanceof Schedule.Cron cron) {
            return cron.expr();
        }
        if (schedule instanceof Schedule.Every every) {
            return Long.toString(every.everyMs());
        }
        return null;
    }

    static String targetAgentKey(String sessionTarget, String instructions) {
        if (sessionTarget != null && !sessionTarget.isBlank()) {
            return sessionTarget;
        }
        if (instructions != null) {
            Matcher matcher = AGENT_HEADER.matcher(instructions);
            if (matcher.find()) {
                return "agent:" + matcher.group(1).replaceFirst("^agent:", "");
            }
        }
        return DEFAULT_TARGET_AGENT;
    }

    private String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() <= instructionsMaxChars ? value : value.substring(0, instructionsMaxChars);
    }

    // 0 means "never" in Executor state
    private static Instant instant(Long epochMs) {
        return epochMs == null || epochMs == 0 ? null : Instant.ofEpochMilli(epochMs);
    }
}
