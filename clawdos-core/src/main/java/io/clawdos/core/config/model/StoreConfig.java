package io.clawdos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.clawdos.core.config.ConfigException;
import java.time.Duration;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(
    String backend,
    String url,
    String serviceKey,
    String sqlitePath,
    int httpTimeoutSeconds
) {
    public static final String POSTGREST = "postgrest";
    public static final String SQLITE = "sqlite";

    public static StoreConfig defaults() {
        return new StoreConfig(POSTGREST, "", "", "~/.clawdos/cron-mirror.db", 30);
    }

    public String normalizedBackend() {
        return backend == null || backend.isBlank() ? POSTGREST : backend.trim().toLowerCase(Locale.ROOT);
    }

    public boolean configured() {
        if (SQLITE.equals(normalizedBackend())) {
            return sqlitePath != null && !sqlitePath.isBlank();
        }
        return url != null && !url.isBlank() && serviceKey != null && !serviceKey.isBlank();
    }

    public Duration httpTimeout() {
        return Duration.ofSeconds(httpTimeoutSeconds);
    }

    void validate() {
        String kind = normalizedBackend();
        if (!POSTGREST.equals(kind) && !SQLITE.equals(kind)) {
            throw new ConfigException("store.backend must be 'postgrest' or 'sqlite', got '" + backend + "'");
        }
        if (!configured()) {
            throw new ConfigException(POSTGREST.equals(kind)
                ? "Missing store credentials. Need SUPABASE_URL and SUPABASE_SERVICE_ROLE_KEY"
                : "Missing store.sqlitePath");
        }
        if (httpTimeoutSeconds <= 0) {
            throw new ConfigException("store.httpTimeoutSeconds must be > 0");
        }
    }
}
