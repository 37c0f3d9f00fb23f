package io.clawdos.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.clawdos.core.mirror.CronMirrorRow;
import io.clawdos.core.observability.ActivityEvent;
import io.clawdos.core.queue.CommandQueue;
import io.clawdos.core.queue.CommandRequest;
import io.clawdos.core.queue.RequestStatus;
import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Mirror store backed by a PostgREST endpoint (Supabase {@code /rest/v1}), authenticated with the
 * service-role key.
 */
public final class PostgrestStore implements CronMirrorStore {
    private static final MediaType JSON = MediaType.get("application/json");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final String MIRROR_TABLE = "cron_mirror";
    private static final String ACTIVITIES_TABLE = "activities";
    private static final String UPSERT = "resolution=merge-duplicates,return=minimal";
    private static final String REPRESENTATION = "return=representation";
    private static final String MINIMAL = "return=minimal";
    private static final int ERROR_BODY_CHARS = 300;

    private final String baseUrl;
    private final String serviceKey;
    private final String projectId;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public PostgrestStore(String baseUrl, String serviceKey, String projectId, OkHttpClient client) {
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.serviceKey = serviceKey;
        this.projectId = projectId;
        this.client = client;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public Optional<String> loadFingerprint() throws IOException {
        HttpUrl url = table(MIRROR_TABLE)
            .addQueryParameter("select", "schedule_expr")
            .addQueryParameter("project_id", "eq." + projectId)
            .addQueryParameter("job_id", "eq." + CronMirrorRow.SENTINEL_JOB_ID)
            .addQueryParameter("limit", "1")
            .build();
        JsonNode rows = execute(request(url).get().build(), "read fingerprint");
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(text(rows.get(0).path("schedule_expr")));
    }

    @Override
    public void upsertJobs(List<CronMirrorRow> rows) throws IOException {
        upsert(rows);
    }

    @Override
    public void saveFingerprint(String fingerprint) throws IOException {
        upsert(List.of(CronMirrorRow.sentinel(projectId, fingerprint)));
    }

    @Override
    public Set<String> mirroredJobIds() throws IOException {
        HttpUrl url = table(MIRROR_TABLE)
            .addQueryParameter("select", "job_id")
            .addQueryParameter("project_id", "eq." + projectId)
            .addQueryParameter("job_id", "neq." + CronMirrorRow.SENTINEL_JOB_ID)
            .build();
        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode row : execute(request(url).get().build(), "list mirrored job ids")) {
            ids.add(row.path("job_id").asText());
        }
        return ids;
    }

    @Override
    public int deleteJobsNotIn(Set<String> keepJobIds) throws IOException {
        List<String> quoted = new ArrayList<>();
        for (String id : keepJobIds) {
            quoted.add(mapper.writeValueAsString(id));
        }
        quoted.add(mapper.writeValueAsString(CronMirrorRow.SENTINEL_JOB_ID));
        HttpUrl url = table(MIRROR_TABLE)
            .addQueryParameter("project_id", "eq." + projectId)
            .addQueryParameter("job_id", "not.in.(" + String.join(",", quoted) + ")")
            .build();
        Request request = request(url)
            .header("Prefer", REPRESENTATION)
            .delete()
            .build();
        return execute(request, "prune mirror rows").size();
    }

    @Override
    public List<CronMirrorRow> listJobs() throws IOException {
        HttpUrl url = table(MIRROR_TABLE)
            .addQueryParameter("select", "*")
            .addQueryParameter("project_id", "eq." + projectId)
            .addQueryParameter("job_id", "neq." + CronMirrorRow.SENTINEL_JOB_ID)
            .addQueryParameter("order", "job_id.asc")
            .build();
        List<CronMirrorRow> rows = new ArrayList<>();
        for (JsonNode node : execute(request(url).get().build(), "list mirror rows")) {
            rows.add(new CronMirrorRow(
                text(node.path("project_id")),
                text(node.path("job_id")),
                text(node.path("name")),
                text(node.path("schedule_kind")),
                text(node.path("schedule_expr")),
                text(node.path("tz")),
                node.path("enabled").asBoolean(false),
                instant(node.path("next_run_at")),
                instant(node.path("last_run_at")),
                text(node.path("last_status")),
                node.path("last_duration_ms").isNumber() ? node.path("last_duration_ms").asLong() : null,
                text(node.path("instructions")),
                text(node.path("target_agent_key"))
            ));
        }
        return rows;
    }

    @Override
    public List<CommandRequest> fetchQueued(CommandQueue queue, int limit) throws IOException {
        HttpUrl url = queuedRequests(queue, limit).build();
        return requests(execute(request(url).get().build(), "read " + queue.table()));
    }

    @Override
    public List<CommandRequest> fetchQueuedBefore(CommandQueue queue, Instant cutoff, int limit) throws IOException {
        HttpUrl url = queuedRequests(queue, limit)
            .addQueryParameter("requested_at", "lt." + cutoff)
            .build();
        return requests(execute(request(url).get().build(), "read stale " + queue.table()));
    }

    @Override
    public boolean transition(
        CommandQueue queue,
        String requestId,
        RequestStatus from,
        RequestStatus to,
        Map<String, Object> result
    ) throws IOException {
        from.requireMoveTo(to);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", to.wireName());
        if (result != null) {
            body.put("result", result);
        }
        HttpUrl url = table(queue.table())
            .addQueryParameter("id", "eq." + requestId)
            .addQueryParameter("project_id", "eq." + projectId)
            .addQueryParameter("status", "eq." + from.wireName())
            .build();
        Request request = request(url)
            .header("Prefer", REPRESENTATION)
            .patch(body(body))
            .build();
        return !execute(request, "update " + queue.table() + " request " + requestId).isEmpty();
    }

    @Override
    public String enqueue(CommandQueue queue, String jobId, Map<String, Object> patch) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("project_id", projectId);
        body.put("job_id", jobId);
        body.put("status", RequestStatus.QUEUED.wireName());
        if (queue == CommandQueue.PATCH) {
            body.put("patch_json", patch == null ? Map.of() : patch);
        }
        Request request = request(table(queue.table()).build())
            .header("Prefer", REPRESENTATION)
            .post(body(body))
            .build();
        JsonNode created = execute(request, "enqueue " + queue.table());
        if (created.isEmpty()) {
            throw new IOException("PostgREST returned no row for new " + queue.table() + " request");
        }
        return created.get(0).path("id").asText();
    }

    @Override
    public Optional<CommandRequest> find(CommandQueue queue, String requestId) throws IOException {
        HttpUrl url = table(queue.table())
            .addQueryParameter("select", selectColumns(queue))
            .addQueryParameter("project_id", "eq." + projectId)
            .addQueryParameter("id", "eq." + requestId)
            .build();
        List<CommandRequest> found = requests(execute(request(url).get().build(), "read " + queue.table()));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public void record(ActivityEvent event) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("project_id", projectId);
        body.put("type", event.type());
        body.put("message", event.message());
        body.put("actor_agent_key", event.actorAgentKey());
        Request request = request(table(ACTIVITIES_TABLE).build())
            .header("Prefer", MINIMAL)
            .post(body(body))
            .build();
        execute(request, "record activity");
    }

    @Override
    public List<ActivityEvent> recent(int limit) throws IOException {
        HttpUrl url = table(ACTIVITIES_TABLE)
            .addQueryParameter("select", "type,message,actor_agent_key")
            .addQueryParameter("project_id", "eq." + projectId)
            .addQueryParameter("order", "created_at.desc")
            .addQueryParameter("limit", Integer.toString(Math.max(1, limit)))
            .build();
        List<ActivityEvent> events = new ArrayList<>();
        for (JsonNode node : execute(request(url).get().build(), "list activities")) {
            events.add(new ActivityEvent(
                text(node.path("type")),
                text(node.path("message")),
                text(node.path("actor_agent_key"))
            ));
        }
        return events;
    }

    private void upsert(List<CronMirrorRow> rows) throws IOException {
        List<Map<String, Object>> body = new ArrayList<>(rows.size());
        for (CronMirrorRow row : rows) {
            body.add(toJson(row));
        }
        HttpUrl url = table(MIRROR_TABLE)
            .addQueryParameter("on_conflict", "project_id,job_id")
            .build();
        Request request = request(url)
            .header("Prefer", UPSERT)
            .post(body(body))
            .build();
        execute(request, "upsert mirror rows");
    }

    private Map<String, Object> toJson(CronMirrorRow row) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("project_id", row.projectId());
        json.put("job_id", row.jobId());
        json.put("name", row.name());
        json.put("schedule_kind", row.scheduleKind());
        json.put("schedule_expr", row.scheduleExpr());
        json.put("tz", row.tz());
        json.put("enabled", row.enabled());
        json.put("next_run_at", row.nextRunAt());
        json.put("last_run_at", row.lastRunAt());
        json.put("last_status", row.lastStatus());
        json.put("last_duration_ms", row.lastDurationMs());
        json.put("instructions", row.instructions());
        json.put("target_agent_key", row.targetAgentKey());
        return json;
    }

    private HttpUrl.Builder queuedRequests(CommandQueue queue, int limit) {
        return table(queue.table())
            .addQueryParameter("select", selectColumns(queue))
            .addQueryParameter("project_id", "eq." + projectId)
            .addQueryParameter("status", "eq." + RequestStatus.QUEUED.wireName())
            .addQueryParameter("order", "requested_at.asc")
            .addQueryParameter("limit", Integer.toString(Math.max(1, limit)));
    }

    private static String selectColumns(CommandQueue queue) {
        return queue == CommandQueue.PATCH
            ? "id,job_id,status,requested_at,result,patch_json"
            : "id,job_id,status,requested_at,result";
    }

    private List<CommandRequest> requests(JsonNode rows) throws IOException {
        List<CommandRequest> requests = new ArrayList<>();
        for (JsonNode node : rows) {
            requests.add(new CommandRequest(
                node.path("id").asText(),
                node.path("job_id").asText(),
                RequestStatus.fromWire(node.path("status").asText()),
                instant(node.path("requested_at")),
                patch(node.path("patch_json")),
                node.path("result").isObject() ? mapper.convertValue(node.get("result"), MAP_TYPE) : Map.of()
            ));
        }
        return requests;
    }

    // patch_json may be a json column or a string holding JSON
    private JsonNode patch(JsonNode node) throws IOException {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            try {
                return mapper.readTree(node.asText());
            } catch (JsonProcessingException e) {
                return node;
            }
        }
        return node;
    }

    private Request.Builder request(HttpUrl url) {
        return new Request.Builder()
            .url(url)
            .header("apikey", serviceKey)
            .header("Authorization", "Bearer " + serviceKey)
            .header("Accept", "application/json");
    }

    private RequestBody body(Object payload) throws JsonProcessingException {
        return RequestBody.create(mapper.writeValueAsString(payload), JSON);
    }

    private HttpUrl.Builder table(String table) {
        HttpUrl url = HttpUrl.parse(baseUrl + "/rest/v1/" + table);
        if (url == null) {
            throw new IllegalStateException("Invalid store url: " + baseUrl);
        }
        return url.newBuilder();
    }

    private JsonNode execute(Request request, String action) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new IOException("PostgREST " + action + " failed: HTTP " + response.code() + " " + truncate(raw));
            }
            if (raw.isBlank()) {
                return mapper.createArrayNode();
            }
            JsonNode parsed = mapper.readTree(raw);
            return parsed.isArray() ? parsed : mapper.createArrayNode().add(parsed);
        }
    }

    private static String text(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static Instant instant(JsonNode node) throws IOException {
        String value = text(node);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new IOException("Unparseable timestamp from PostgREST: " + value, e);
        }
    }

    private static String truncate(String value) {
        return value.length() <= ERROR_BODY_CHARS ? value : value.substring(0, ERROR_BODY_CHARS) + "...";
    }

    private static String normalizeBaseUrl(String value) {
        String raw = value == null ? "" : value.trim();
        while (raw.endsWith("/")) {
            raw = raw.substring(0, raw.length() - 1);
        }
        return raw;
    }
}
