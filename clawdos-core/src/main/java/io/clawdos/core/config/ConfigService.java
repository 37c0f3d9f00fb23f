package io.clawdos.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.clawdos.core.config.model.MirrorConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link MirrorConfig} in three layers: built-in defaults, the JSON config file, then
 * environment variables. Later layers win field by field.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
    }

    public MirrorConfig load(Path configPath) throws IOException {
        return load(configPath, System.getenv());
    }

    public MirrorConfig load(Path configPath, Map<String, String> env) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(env, "env must not be null");

        JsonNode merged = mapper.valueToTree(MirrorConfig.defaults());
        if (Files.exists(configPath)) {
            merged = deepMerge(merged, mapper.readTree(Files.readString(configPath)));
        }
        merged = deepMerge(merged, envOverrides(env));
        return mapper.treeToValue(merged, MirrorConfig.class);
    }

    public void save(Path configPath, MirrorConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    /**
     * Writes a config file holding the defaults, or refreshes an existing one so new default fields show up.
     *
     * @return {@code true} when the file did not exist before
     */
    public boolean init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        MirrorConfig config = created || overwrite
            ? MirrorConfig.defaults()
            : load(configPath, Map.of());
        save(configPath, config);
        return created;
    }

    public String toPrettyJson(MirrorConfig config) {
        try {
            ObjectNode node = mapper.valueToTree(config);
            JsonNode store = node.get("store");
            if (store instanceof ObjectNode storeNode && !storeNode.path("serviceKey").asText("").isEmpty()) {
                storeNode.put("serviceKey", "***");
            }
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode envOverrides(Map<String, String> env) {
        ObjectNode root = mapper.createObjectNode();
        String projectId = firstNonBlank(env, List.of("CLAWDOS_PROJECT_ID", "CLAWDOX_PROJECT_ID", "CLAWDO_PROJECT_ID"));
        if (projectId != null) {
            root.put("projectId", projectId);
        }
        String bin = firstNonBlank(env, List.of("EXECUTOR_BIN", "CLAWDBOT_BIN", "OPENCLAW_BIN"));
        if (bin != null) {
            root.putObject("executor").put("bin", bin);
        }

        ObjectNode store = mapper.createObjectNode();
        putIfPresent(store, "backend", firstNonBlank(env, List.of("CRON_MIRROR_STORE")));
        putIfPresent(store, "url", firstNonBlank(env, List.of("SUPABASE_URL", "VITE_SUPABASE_URL")));
        putIfPresent(store, "serviceKey", firstNonBlank(env, List.of("SUPABASE_SERVICE_ROLE_KEY")));
        putIfPresent(store, "sqlitePath", firstNonBlank(env, List.of("CRON_MIRROR_SQLITE_PATH")));
        if (store.size() > 0) {
            root.set("store", store);
        }
        return root;
    }

    private static String firstNonBlank(Map<String, String> env, List<String> keys) {
        for (String key : keys) {
            String value = env.get(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
