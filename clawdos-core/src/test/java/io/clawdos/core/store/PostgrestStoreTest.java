package io.clawdos.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clawdos.core.mirror.CronMirrorRow;
import io.clawdos.core.observability.ActivityEvent;
import io.clawdos.core.queue.CommandQueue;
import io.clawdos.core.queue.CommandRequest;
import io.clawdos.core.queue.RequestStatus;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PostgrestStoreTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private PostgrestStore store;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        store = new PostgrestStore(server.url("/").toString(), "service-key", "front-office", new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldReadFingerprintFromSentinelRow() throws Exception {
        server.enqueue(json("[{\"schedule_expr\":\"9f3a11c0\"}]"));

        assertThat(store.loadFingerprint()).contains("9f3a11c0");

        RecordedRequest request = server.takeRequest();
        HttpUrl url = request.getRequestUrl();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(url.encodedPath()).isEqualTo("/rest/v1/cron_mirror");
        assertThat(url.queryParameter("project_id")).isEqualTo("eq.front-office");
        assertThat(url.queryParameter("job_id")).isEqualTo("eq.__mirror_state__");
        assertThat(request.getHeader("apikey")).isEqualTo("service-key");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer service-key");
    }

    @Test
    void shouldReturnEmptyFingerprintBeforeFirstCycle() throws Exception {
        server.enqueue(json("[]"));

        assertThat(store.loadFingerprint()).isEmpty();
    }

    @Test
    void shouldUpsertRowsOnConflictKey() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));

        store.upsertJobs(List.of(new CronMirrorRow(
            "front-office", "a", "Digest", "cron", "0 8 * * *", null, true,
            Instant.parse("2026-03-01T08:00:00Z"), null, "ok", 42L, "summarize", "agent:main:main"
        )));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getRequestUrl().queryParameter("on_conflict")).isEqualTo("project_id,job_id");
        assertThat(request.getHeader("Prefer")).contains("resolution=merge-duplicates");

        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.isArray()).isTrue();
        JsonNode row = body.get(0);
        assertThat(row.path("job_id").asText()).isEqualTo("a");
        assertThat(row.path("schedule_kind").asText()).isEqualTo("cron");
        assertThat(row.path("next_run_at").asText()).isEqualTo("2026-03-01T08:00:00Z");
        assertThat(row.path("last_run_at").isNull()).isTrue();
        assertThat(row.path("tz").isNull()).isTrue();
        assertThat(row.path("last_duration_ms").asLong()).isEqualTo(42L);
    }

    @Test
    void shouldWriteSentinelWhenSavingFingerprint() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));

        store.saveFingerprint("abcd");

        JsonNode row = mapper.readTree(server.takeRequest().getBody().readUtf8()).get(0);
        assertThat(row.path("job_id").asText()).isEqualTo(CronMirrorRow.SENTINEL_JOB_ID);
        assertThat(row.path("schedule_kind").asText()).isEqualTo("state");
        assertThat(row.path("schedule_expr").asText()).isEqualTo("abcd");
        assertThat(row.path("enabled").asBoolean(true)).isFalse();
    }

    @Test
    void shouldPruneWithNotInFilterThatKeepsSentinel() throws Exception {
        server.enqueue(json("[{\"job_id\":\"gone\"}]"));

        int deleted = store.deleteJobsNotIn(Set.of("a"));

        RecordedRequest request = server.takeRequest();
        assertThat(deleted).isEqualTo(1);
        assertThat(request.getMethod()).isEqualTo("DELETE");
        assertThat(request.getRequestUrl().queryParameter("job_id"))
            .isEqualTo("not.in.(\"a\",\"__mirror_state__\")");
    }

    @Test
    void shouldReportWhetherConditionalUpdateMatched() throws Exception {
        server.enqueue(json("[{\"id\":\"r1\",\"status\":\"running\"}]"));
        server.enqueue(json("[]"));

        boolean claimed = store.transition(CommandQueue.RUN, "r1", RequestStatus.QUEUED, RequestStatus.RUNNING, null);
        boolean again = store.transition(
            CommandQueue.RUN, "r1", RequestStatus.RUNNING, RequestStatus.DONE, Map.of("exitCode", 0)
        );

        assertThat(claimed).isTrue();
        assertThat(again).isFalse();

        RecordedRequest claim = server.takeRequest();
        assertThat(claim.getMethod()).isEqualTo("PATCH");
        assertThat(claim.getRequestUrl().encodedPath()).isEqualTo("/rest/v1/cron_run_requests");
        assertThat(claim.getRequestUrl().queryParameter("id")).isEqualTo("eq.r1");
        assertThat(claim.getRequestUrl().queryParameter("status")).isEqualTo("eq.queued");
        assertThat(claim.getHeader("Prefer")).isEqualTo("return=representation");
        assertThat(mapper.readTree(claim.getBody().readUtf8()).has("result")).isFalse();

        JsonNode finish = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(finish.path("status").asText()).isEqualTo("done");
        assertThat(finish.path("result").path("exitCode").asInt()).isZero();
    }

    @Test
    void shouldParseQueuedRequests() throws Exception {
        server.enqueue(json("""
            [{"id":"p1","job_id":"a","status":"queued","requested_at":"2026-03-01T10:00:00.123456+00:00",
              "result":null,"patch_json":{"enabled":false}}]
            """));

        List<CommandRequest> queued = store.fetchQueuedBefore(
            CommandQueue.PATCH, Instant.parse("2026-03-01T10:05:00Z"), 25
        );

        assertThat(queued).hasSize(1);
        CommandRequest request = queued.get(0);
        assertThat(request.requestedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:00.123456Z"));
        assertThat(request.patch().path("enabled").asBoolean(true)).isFalse();
        assertThat(request.result()).isEmpty();

        HttpUrl url = server.takeRequest().getRequestUrl();
        assertThat(url.encodedPath()).isEqualTo("/rest/v1/cron_job_patch_requests");
        assertThat(url.queryParameter("status")).isEqualTo("eq.queued");
        assertThat(url.queryParameter("requested_at")).isEqualTo("lt.2026-03-01T10:05:00Z");
        assertThat(url.queryParameter("order")).isEqualTo("requested_at.asc");
        assertThat(url.queryParameter("limit")).isEqualTo("25");
    }

    @Test
    void shouldReturnIdOfEnqueuedRequest() throws Exception {
        server.enqueue(json("[{\"id\":\"3f1c\",\"status\":\"queued\"}]"));

        String id = store.enqueue(CommandQueue.DELETE, "job-7", null);

        assertThat(id).isEqualTo("3f1c");
        JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("job_id").asText()).isEqualTo("job-7");
        assertThat(body.path("status").asText()).isEqualTo("queued");
        assertThat(body.has("patch_json")).isFalse();
    }

    @Test
    void shouldPostActivities() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));

        store.record(new ActivityEvent("watchdog", "marked stuck", "agent:cron-mirror"));

        JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("project_id").asText()).isEqualTo("front-office");
        assertThat(body.path("actor_agent_key").asText()).isEqualTo("agent:cron-mirror");
    }

    @Test
    void shouldFailOnErrorStatus() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"message\":\"Invalid API key\"}"));

        assertThatThrownBy(() -> store.mirroredJobIds())
            .isInstanceOf(IOException.class)
            .hasMessageContaining("HTTP 401")
            .hasMessageContaining("Invalid API key");
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
