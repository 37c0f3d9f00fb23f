package io.clawdos.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clawdos.core.mirror.CronMirrorRow;
import io.clawdos.core.observability.ActivityEvent;
import io.clawdos.core.queue.CommandQueue;
import io.clawdos.core.queue.CommandRequest;
import io.clawdos.core.queue.RequestStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Embedded mirror store with the same tables as the hosted one. Suits single-machine setups and is
 * what the tests run against.
 */
public final class SqliteStore implements CronMirrorStore {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String jdbcUrl;
    private final String projectId;
    private final Clock clock;
    private final ObjectMapper mapper;

    public SqliteStore(Path dbPath, String projectId, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.projectId = projectId;
        this.clock = clock;
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public synchronized Optional<String> loadFingerprint() throws IOException {
        String sql = "SELECT schedule_expr FROM cron_mirror WHERE project_id = ? AND job_id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, projectId);
            statement.setString(2, CronMirrorRow.SENTINEL_JOB_ID);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.ofNullable(resultSet.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read mirror fingerprint", e);
        }
    }

    @Override
    public synchronized void upsertJobs(List<CronMirrorRow> rows) throws IOException {
        upsert(rows);
    }

    @Override
    public synchronized void saveFingerprint(String fingerprint) throws IOException {
        upsert(List.of(CronMirrorRow.sentinel(projectId, fingerprint)));
    }

    @Override
    public synchronized Set<String> mirroredJobIds() throws IOException {
        String sql = "SELECT job_id FROM cron_mirror WHERE project_id = ? AND job_id <> ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, projectId);
            statement.setString(2, CronMirrorRow.SENTINEL_JOB_ID);
            Set<String> ids = new LinkedHashSet<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    ids.add(resultSet.getString(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new IOException("Failed to list mirrored job ids", e);
        }
    }

    @Override
    public synchronized int deleteJobsNotIn(Set<String> keepJobIds) throws IOException {
        List<String> keep = new ArrayList<>(keepJobIds);
        keep.add(CronMirrorRow.SENTINEL_JOB_ID);
        String placeholders = String.join(",", Collections.nCopies(keep.size(), "?"));
        String sql = "DELETE FROM cron_mirror WHERE project_id = ? AND job_id NOT IN (" + placeholders + ")";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, projectId);
            for (int i = 0; i < keep.size(); i++) {
                statement.setString(i + 2, keep.get(i));
            }
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to prune mirror rows", e);
        }
    }

    @Override
    public synchronized List<CronMirrorRow> listJobs() throws IOException {
        String sql = """
            SELECT project_id, job_id, name, schedule_kind, schedule_expr, tz, enabled, next_run_at, last_run_at,
                   last_status, last_duration_ms, instructions, target_agent_key
            FROM cron_mirror
            WHERE project_id = ? AND job_id <> ?
            ORDER BY job_id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, projectId);
            statement.setString(2, CronMirrorRow.SENTINEL_JOB_ID);
            List<CronMirrorRow> rows = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    Object duration = resultSet.getObject("last_duration_ms");
                    rows.add(new CronMirrorRow(
                        resultSet.getString("project_id"),
                        resultSet.getString("job_id"),
                        resultSet.getString("name"),
                        resultSet.getString("schedule_kind"),
                        resultSet.getString("schedule_expr"),
                        resultSet.getString("tz"),
                        resultSet.getInt("enabled") != 0,
                        instant(resultSet.getString("next_run_at")),
                        instant(resultSet.getString("last_run_at")),
                        resultSet.getString("last_status"),
                        duration == null ? null : ((Number) duration).longValue(),
                        resultSet.getString("instructions"),
                        resultSet.getString("target_agent_key")
                    ));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new IOException("Failed to list mirror rows", e);
        }
    }

    @Override
    public synchronized List<CommandRequest> fetchQueued(CommandQueue queue, int limit) throws IOException {
        return selectRequests(queue, "status = ?", List.of(RequestStatus.QUEUED.wireName()), limit);
    }

    @Override
    public synchronized List<CommandRequest> fetchQueuedBefore(CommandQueue queue, Instant cutoff, int limit)
        throws IOException {
        return selectRequests(
            queue,
            "status = ? AND requested_at_ms < ?",
            List.of(RequestStatus.QUEUED.wireName(), cutoff.toEpochMilli()),
            limit
        );
    }

    @Override
    public synchronized boolean transition(
        CommandQueue queue,
        String requestId,
        RequestStatus from,
        RequestStatus to,
        Map<String, Object> result
    ) throws IOException {
        from.requireMoveTo(to);
        String sql = "UPDATE " + queue.table()
            + " SET status = ?, result_json = COALESCE(?, result_json) WHERE id = ? AND project_id = ? AND status = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, to.wireName());
            if (result == null) {
                statement.setNull(2, Types.VARCHAR);
            } else {
                statement.setString(2, mapper.writeValueAsString(result));
            }
            statement.setString(3, requestId);
            statement.setString(4, projectId);
            statement.setString(5, from.wireName());
            return statement.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IOException("Failed to update " + queue.table() + " request " + requestId, e);
        }
    }

    @Override
    public synchronized String enqueue(CommandQueue queue, String jobId, Map<String, Object> patch) throws IOException {
        String id = UUID.randomUUID().toString();
        boolean withPatch = queue == CommandQueue.PATCH;
        String sql = withPatch
            ? "INSERT INTO " + queue.table() + " (id, project_id, job_id, status, requested_at_ms, patch_json) VALUES (?, ?, ?, ?, ?, ?)"
            : "INSERT INTO " + queue.table() + " (id, project_id, job_id, status, requested_at_ms) VALUES (?, ?, ?, ?, ?)";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            statement.setString(2, projectId);
            statement.setString(3, jobId);
            statement.setString(4, RequestStatus.QUEUED.wireName());
            statement.setLong(5, clock.millis());
            if (withPatch) {
                statement.setString(6, mapper.writeValueAsString(patch == null ? Map.of() : patch));
            }
            statement.executeUpdate();
            return id;
        } catch (SQLException e) {
            throw new IOException("Failed to enqueue " + queue.table() + " request", e);
        }
    }

    @Override
    public synchronized Optional<CommandRequest> find(CommandQueue queue, String requestId) throws IOException {
        List<CommandRequest> found = selectRequests(queue, "id = ?", List.of(requestId), 1);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public synchronized void record(ActivityEvent event) throws IOException {
        String sql = """
            INSERT INTO activities (project_id, type, message, actor_agent_key, created_at_ms)
            VALUES (?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, projectId);
            statement.setString(2, event.type());
            statement.setString(3, event.message());
            statement.setString(4, event.actorAgentKey());
            statement.setLong(5, clock.millis());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to record activity", e);
        }
    }

    @Override
    public synchronized List<ActivityEvent> recent(int limit) throws IOException {
        String sql = """
            SELECT type, message, actor_agent_key FROM activities
            WHERE project_id = ?
            ORDER BY id DESC
            LIMIT ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, projectId);
            statement.setInt(2, Math.max(1, limit));
            List<ActivityEvent> events = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    events.add(new ActivityEvent(
                        resultSet.getString("type"),
                        resultSet.getString("message"),
                        resultSet.getString("actor_agent_key")
                    ));
                }
            }
            return events;
        } catch (SQLException e) {
            throw new IOException("Failed to list activities", e);
        }
    }

    private void upsert(List<CronMirrorRow> rows) throws IOException {
        String sql = """
            INSERT INTO cron_mirror (project_id, job_id, name, schedule_kind, schedule_expr, tz, enabled, next_run_at,
                                     last_run_at, last_status, last_duration_ms, instructions, target_agent_key, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (project_id, job_id) DO UPDATE SET
                name = excluded.name,
                schedule_kind = excluded.schedule_kind,
                schedule_expr = excluded.schedule_expr,
                tz = excluded.tz,
                enabled = excluded.enabled,
                next_run_at = excluded.next_run_at,
                last_run_at = excluded.last_run_at,
                last_status = excluded.last_status,
                last_duration_ms = excluded.last_duration_ms,
                instructions = excluded.instructions,
                target_agent_key = excluded.target_agent_key,
                updated_at = excluded.updated_at
            """;
        String updatedAt = clock.instant().toString();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            connection.setAutoCommit(false);
            try {
                for (CronMirrorRow row : rows) {
                    statement.setString(1, row.projectId());
                    statement.setString(2, row.jobId());
                    statement.setString(3, row.name());
                    statement.setString(4, row.scheduleKind());
                    statement.setString(5, row.scheduleExpr());
                    statement.setString(6, row.tz());
                    statement.setInt(7, row.enabled() ? 1 : 0);
                    statement.setString(8, text(row.nextRunAt()));
                    statement.setString(9, text(row.lastRunAt()));
                    statement.setString(10, row.lastStatus());
                    if (row.lastDurationMs() == null) {
                        statement.setNull(11, Types.INTEGER);
                    } else {
                        statement.setLong(11, row.lastDurationMs());
                    }
                    statement.setString(12, row.instructions());
                    statement.setString(13, row.targetAgentKey());
                    statement.setString(14, updatedAt);
                    statement.addBatch();
                }
                statement.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to upsert mirror rows", e);
        }
    }

    private List<CommandRequest> selectRequests(CommandQueue queue, String where, List<Object> params, int limit)
        throws IOException {
        String patchColumn = queue == CommandQueue.PATCH ? "patch_json" : "NULL AS patch_json";
        String sql = "SELECT id, job_id, status, requested_at_ms, result_json, " + patchColumn
            + " FROM " + queue.table()
            + " WHERE project_id = ? AND " + where
            + " ORDER BY requested_at_ms ASC LIMIT ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            int index = 1;
            statement.setString(index++, projectId);
            for (Object param : params) {
                statement.setObject(index++, param);
            }
            statement.setInt(index, Math.max(1, limit));
            List<CommandRequest> requests = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    requests.add(new CommandRequest(
                        resultSet.getString("id"),
                        resultSet.getString("job_id"),
                        RequestStatus.fromWire(resultSet.getString("status")),
                        Instant.ofEpochMilli(resultSet.getLong("requested_at_ms")),
                        json(resultSet.getString("patch_json")),
                        resultMap(resultSet.getString("result_json"))
                    ));
                }
            }
            return requests;
        } catch (SQLException e) {
            throw new IOException("Failed to read " + queue.table(), e);
        }
    }

    private JsonNode json(String raw) throws IOException {
        return raw == null ? null : mapper.readTree(raw);
    }

    private Map<String, Object> resultMap(String raw) throws IOException {
        return raw == null ? Map.of() : mapper.readValue(raw, MAP_TYPE);
    }

    private static String text(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static Instant instant(String value) {
        return value == null ? null : Instant.parse(value);
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        List<String> ddl = new ArrayList<>();
        ddl.add("""
            CREATE TABLE IF NOT EXISTS cron_mirror (
                project_id TEXT NOT NULL,
                job_id TEXT NOT NULL,
                name TEXT,
                schedule_kind TEXT,
                schedule_expr TEXT,
                tz TEXT,
                enabled INTEGER NOT NULL DEFAULT 0,
                next_run_at TEXT,
                last_run_at TEXT,
                last_status TEXT,
                last_duration_ms INTEGER,
                instructions TEXT,
                target_agent_key TEXT,
                updated_at TEXT,
                PRIMARY KEY (project_id, job_id)
            )
            """);
        for (CommandQueue queue : CommandQueue.values()) {
            ddl.add("CREATE TABLE IF NOT EXISTS " + queue.table() + " ("
                + "id TEXT PRIMARY KEY, "
                + "project_id TEXT NOT NULL, "
                + "job_id TEXT NOT NULL, "
                + "status TEXT NOT NULL, "
                + "requested_at_ms INTEGER NOT NULL, "
                + (queue == CommandQueue.PATCH ? "patch_json TEXT, " : "")
                + "result_json TEXT)");
            ddl.add("CREATE INDEX IF NOT EXISTS idx_" + queue.table() + "_status ON "
                + queue.table() + "(project_id, status, requested_at_ms)");
        }
        ddl.add("""
            CREATE TABLE IF NOT EXISTS activities (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                project_id TEXT NOT NULL,
                type TEXT NOT NULL,
                message TEXT NOT NULL,
                actor_agent_key TEXT,
                created_at_ms INTEGER NOT NULL
            )
            """);
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String sql : ddl) {
                statement.execute(sql);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite mirror store", e);
        }
    }
}
