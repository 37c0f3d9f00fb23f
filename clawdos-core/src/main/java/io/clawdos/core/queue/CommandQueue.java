package io.clawdos.core.queue;

public enum CommandQueue {
    RUN("cron_run_requests"),
    DELETE("cron_delete_requests"),
    PATCH("cron_job_patch_requests");

    private final String table;

    CommandQueue(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }
}
