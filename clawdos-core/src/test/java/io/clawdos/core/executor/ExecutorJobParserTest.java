package io.clawdos.core.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ExecutorJobParserTest {

    private final ExecutorJobParser parser = new ExecutorJobParser();

    @Test
    void shouldParseJobsWrapperWithEveryScheduleKind() throws Exception {
        List<ExecutorJob> jobs = parser.parse("""
            {"jobs": [
              {"id": "a", "name": "Morning brief", "enabled": true,
               "schedule": {"kind": "cron", "expr": "0 8 * * *", "tz": ""},
               "state": {"nextRunAtMs": 1700000000000, "lastStatus": "ok", "lastDurationMs": "1200"},
               "payload": {"message": "@agent:writer summarize"}},
              {"id": "b", "enabled": false, "schedule": {"kind": "every", "everyMs": 60000}},
              {"id": 7, "schedule": {"kind": "at", "atMs": 1700000000000}, "sessionTarget": "agent:ops:main"}
            ]}
            """);

        assertThat(jobs).hasSize(3);
        ExecutorJob cron = jobs.get(0);
        assertThat(cron.schedule()).isEqualTo(new Schedule.Cron("0 8 * * *", null));
        assertThat(cron.nextRunAtMs()).isEqualTo(1_700_000_000_000L);
        assertThat(cron.lastRunAtMs()).isNull();
        assertThat(cron.lastDurationMs()).isEqualTo(1_200L);
        assertThat(cron.instructions()).isEqualTo("@agent:writer summarize");

        assertThat(jobs.get(1).enabled()).isFalse();
        assertThat(jobs.get(1).schedule()).isEqualTo(new Schedule.Every(60_000L));

        ExecutorJob other = jobs.get(2);
        assertThat(other.id()).isEqualTo("7");
        assertThat(other.enabled()).isFalse();
        assertThat(other.schedule().kind()).isEqualTo("at");
        assertThat(other.sessionTarget()).isEqualTo("agent:ops:main");
    }

    @Test
    void shouldAcceptBareArray() throws Exception {
        assertThat(parser.parse("[{\"id\":\"x\"}]")).extracting(ExecutorJob::id).containsExactly("x");
        assertThat(parser.parse("[]")).isEmpty();
    }

    @Test
    void shouldRejectOutputThatIsNotJson() {
        assertThatThrownBy(() -> parser.parse("Gateway not running"))
            .isInstanceOf(ExecutorOutputException.class)
            .hasMessageContaining("Gateway not running");
    }

    @Test
    void shouldRejectUnexpectedShapes() {
        assertThatThrownBy(() -> parser.parse("{\"items\":[]}")).isInstanceOf(ExecutorOutputException.class);
        assertThatThrownBy(() -> parser.parse("[{\"name\":\"no id\"}]"))
            .isInstanceOf(ExecutorOutputException.class)
            .hasMessageContaining("has no id");
        assertThatThrownBy(() -> parser.parse("[{\"id\":\"a\",\"enabled\":\"yes\"}]"))
            .isInstanceOf(ExecutorOutputException.class)
            .hasMessageContaining("enabled");
        assertThatThrownBy(() -> parser.parse("[{\"id\":\"a\",\"schedule\":{\"kind\":\"every\",\"everyMs\":0}}]"))
            .isInstanceOf(ExecutorOutputException.class)
            .hasMessageContaining("everyMs");
        assertThatThrownBy(() -> parser.parse("[{\"id\":\"a\",\"state\":{\"nextRunAtMs\":\"soon\"}}]"))
            .isInstanceOf(ExecutorOutputException.class)
            .hasMessageContaining("nextRunAtMs");
    }
}
