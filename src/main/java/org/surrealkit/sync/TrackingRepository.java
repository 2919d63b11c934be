package org.surrealkit.sync;

import java.util.Map;
import java.util.Optional;

/**
 * Keyed server-side state shared by every invocation against one database.
 *
 * <p>Implementations assume a single writer; upserts replace the previous row for the key.
 */
public interface TrackingRepository<V> {
    Optional<V> get(String key);

    Map<String, V> all();

    void upsert(String key, V value);
}
