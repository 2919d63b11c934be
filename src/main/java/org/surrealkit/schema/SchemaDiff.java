package org.surrealkit.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * File- and entity-level differences between two snapshots.
 */
public final class SchemaDiff {
    private SchemaDiff() {}

    public static FileDiff diff(final SchemaSnapshot previous, final SchemaSnapshot current) {
        final Map<String, String> oldHashes = Objects.requireNonNull(previous, "previous").hashesByPath();
        final Map<String, String> newHashes = Objects.requireNonNull(current, "current").hashesByPath();

        final List<String> added = new ArrayList<>();
        final List<String> modified = new ArrayList<>();
        for (final Map.Entry<String, String> entry : newHashes.entrySet()) {
            final String oldHash = oldHashes.get(entry.getKey());
            if (oldHash == null) {
                added.add(entry.getKey());
            } else if (!oldHash.equals(entry.getValue())) {
                modified.add(entry.getKey());
            }
        }
        final List<String> removed = new ArrayList<>();
        for (final String path : oldHashes.keySet()) {
            if (!newHashes.containsKey(path)) {
                removed.add(path);
            }
        }
        return new FileDiff(added, modified, removed);
    }

    /**
     * Entities present in {@code previous} but absent from {@code current}, in key order.
     */
    public static List<EntityKey> removedEntities(final CatalogSnapshot previous, final CatalogSnapshot current) {
        final TreeSet<EntityKey> stale = new TreeSet<>(Objects.requireNonNull(previous, "previous").entities());
        stale.removeAll(Objects.requireNonNull(current, "current").entities());
        return List.copyOf(stale);
    }
}
