package org.surrealkit.sync;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.surrealkit.client.DatabaseClient;

/**
 * Key/value provenance rows in {@code _surrealkit_sync_meta}.
 */
public final class SyncMetadataRepository implements TrackingRepository<Object> {
    public static final String SHARED = "shared";
    public static final String OWNER = "owner";
    public static final String LAST_SYNC = "last_sync";

    static final String SELECT_ONE = "SELECT value FROM _surrealkit_sync_meta WHERE key = $key LIMIT 1;";
    static final String SELECT_ALL = "SELECT key, value FROM _surrealkit_sync_meta;";
    static final String UPSERT = "DELETE _surrealkit_sync_meta WHERE key = $key; "
            + "CREATE _surrealkit_sync_meta CONTENT { key: $key, value: $value, updated_at: time::now() };";

    private final DatabaseClient client;

    public SyncMetadataRepository(final DatabaseClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public Optional<Object> get(final String key) {
        for (final Object row : client.execute(SELECT_ONE, Map.of("key", key)).rows(0)) {
            if (row instanceof Map<?, ?> map) {
                return Optional.ofNullable(map.get("value"));
            }
        }
        return Optional.empty();
    }

    @Override
    public Map<String, Object> all() {
        final Map<String, Object> values = new TreeMap<>();
        for (final Object row : client.execute(SELECT_ALL).rows(0)) {
            if (row instanceof Map<?, ?> map && map.get("key") instanceof String key) {
                values.put(key, map.get("value"));
            }
        }
        return values;
    }

    @Override
    public void upsert(final String key, final Object value) {
        final Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("key", Objects.requireNonNull(key, "key"));
        bindings.put("value", value);
        client.executeChecked(UPSERT, bindings);
    }
}
