package org.surrealkit.schema;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Last known path to hash state of the schema directory, sorted by path.
 */
public record SchemaSnapshot(int version, List<Entry> files) {
    public static final int CURRENT_VERSION = 1;

    public SchemaSnapshot {
        final TreeMap<String, Entry> byPath = new TreeMap<>();
        for (final Entry entry : Objects.requireNonNull(files, "files")) {
            byPath.put(entry.path(), entry);
        }
        files = List.copyOf(byPath.values());
    }

    public static SchemaSnapshot empty() {
        return new SchemaSnapshot(CURRENT_VERSION, List.of());
    }

    public static SchemaSnapshot fromFiles(final List<SchemaFile> files) {
        final List<Entry> entries = new ArrayList<>();
        for (final SchemaFile file : Objects.requireNonNull(files, "files")) {
            entries.add(new Entry(file.path(), file.hash()));
        }
        entries.sort(Comparator.comparing(Entry::path));
        return new SchemaSnapshot(CURRENT_VERSION, entries);
    }

    /**
     * Sorted path to hash view.
     */
    public Map<String, String> hashesByPath() {
        final Map<String, String> result = new LinkedHashMap<>();
        for (final Entry entry : files) {
            result.put(entry.path(), entry.hash());
        }
        return result;
    }

    public Map<String, Object> toMap() {
        final List<Map<String, Object>> items = new ArrayList<>(files.size());
        for (final Entry entry : files) {
            final Map<String, Object> item = new LinkedHashMap<>();
            item.put("path", entry.path());
            item.put("hash", entry.hash());
            items.add(item);
        }
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("version", version);
        root.put("files", items);
        return root;
    }

    public static SchemaSnapshot fromMap(final Map<String, Object> root) {
        final int version = SnapshotFields.readVersion(root);
        final List<Entry> entries = new ArrayList<>();
        final List<Map<?, ?>> items = SnapshotFields.readObjectList(root, "files");
        for (int i = 0; i < items.size(); i++) {
            final Map<?, ?> item = items.get(i);
            if (!(item.get("path") instanceof String path) || !(item.get("hash") instanceof String hash)) {
                throw new IllegalArgumentException("files[" + i + "] requires string path and hash");
            }
            entries.add(new Entry(path, hash));
        }
        return new SchemaSnapshot(version, entries);
    }

    public record Entry(String path, String hash) {
        public Entry {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(hash, "hash");
        }
    }
}
