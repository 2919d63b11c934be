package org.surrealkit.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entities recognised across all schema files at one point in time.
 */
public record CatalogSnapshot(int version, Set<EntityKey> entities) {
    public static final int CURRENT_VERSION = 1;

    public CatalogSnapshot {
        entities = Set.copyOf(Objects.requireNonNull(entities, "entities"));
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(CURRENT_VERSION, Set.of());
    }

    public static CatalogSnapshot of(final Collection<EntityKey> entities) {
        return new CatalogSnapshot(CURRENT_VERSION, new TreeSet<>(entities));
    }

    public List<EntityKey> sortedEntities() {
        return List.copyOf(new TreeSet<>(entities));
    }

    public Map<String, Object> toMap() {
        final List<Map<String, Object>> items = new ArrayList<>(entities.size());
        for (final EntityKey entity : sortedEntities()) {
            items.add(entity.toMap());
        }
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("version", version);
        root.put("entities", items);
        return root;
    }

    public static CatalogSnapshot fromMap(final Map<String, Object> root) {
        final int version = SnapshotFields.readVersion(root);
        final List<Map<?, ?>> items = SnapshotFields.readObjectList(root, "entities");
        final Set<EntityKey> entities = new TreeSet<>();
        for (int i = 0; i < items.size(); i++) {
            entities.add(EntityKey.fromMap(items.get(i), "entities[" + i + "]"));
        }
        return new CatalogSnapshot(version, entities);
    }
}
