package io.clawdos.core.store;

import io.clawdos.core.config.ConfigException;
import io.clawdos.core.config.ConfigPaths;
import io.clawdos.core.config.model.MirrorConfig;
import io.clawdos.core.config.model.StoreConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import okhttp3.OkHttpClient;

public final class MirrorStores {

    private MirrorStores() {
    }

    /**
     * Opens the backend named by {@code store.backend}.
     *
     * @throws ConfigException when the backend is unknown or its settings are missing
     */
    public static CronMirrorStore open(MirrorConfig config, Clock clock) throws IOException {
        StoreConfig store = config.store();
        String backend = store.normalizedBackend();
        if (!store.configured()) {
            throw new ConfigException("Store backend '" + backend + "' is not configured");
        }
        if (StoreConfig.SQLITE.equals(backend)) {
            Path sqlitePath = ConfigPaths.resolve(store.sqlitePath());
            return new SqliteStore(sqlitePath, config.projectId(), clock);
        }
        if (StoreConfig.POSTGREST.equals(backend)) {
            OkHttpClient client = new OkHttpClient.Builder()
                .callTimeout(store.httpTimeout())
                .build();
            return new PostgrestStore(store.url(), store.serviceKey(), config.projectId(), client);
        }
        throw new ConfigException("Unknown store backend: " + store.backend());
    }
}
