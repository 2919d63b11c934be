package org.surrealkit.sync;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.surrealkit.client.DatabaseClient;

/**
 * Current applied hash per schema path, stored in {@code _surrealkit_sync}.
 */
public final class SyncHashRepository implements TrackingRepository<String> {
    static final String SELECT_ALL = "SELECT path, hash FROM _surrealkit_sync;";
    static final String UPSERT = "DELETE _surrealkit_sync WHERE path = $path; "
            + "CREATE _surrealkit_sync CONTENT { path: $path, hash: $hash, synced_at: time::now() };";

    private final DatabaseClient client;

    public SyncHashRepository(final DatabaseClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public Optional<String> get(final String path) {
        return Optional.ofNullable(all().get(path));
    }

    @Override
    public Map<String, String> all() {
        final Map<String, String> hashes = new TreeMap<>();
        for (final Object row : client.execute(SELECT_ALL).rows(0)) {
            if (row instanceof Map<?, ?> map
                    && map.get("path") instanceof String path
                    && map.get("hash") instanceof String hash) {
                hashes.put(path, hash);
            }
        }
        return hashes;
    }

    @Override
    public void upsert(final String path, final String hash) {
        final Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("path", Objects.requireNonNull(path, "path"));
        bindings.put("hash", Objects.requireNonNull(hash, "hash"));
        client.executeChecked(UPSERT, bindings);
    }
}
