package org.surrealkit.schema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.surrealkit.config.ProjectLayout;
import org.surrealkit.json.JsonEncoder;
import org.surrealkit.json.JsonValues;

/**
 * Local persistence of the file-hash and catalog snapshots under {@code database/.surrealkit}.
 *
 * <p>A missing snapshot file loads as an empty snapshot. Files are written as pretty JSON with a
 * trailing newline.
 */
public final class SnapshotStore {
    private final ProjectLayout layout;

    public SnapshotStore(final ProjectLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public void ensureStateDirectories() throws IOException {
        createDirectories(layout.schemaDir());
        createDirectories(layout.stateDir());
    }

    public SchemaSnapshot loadSchemaSnapshot() throws IOException {
        final Map<String, Object> root = read(layout.schemaSnapshotFile());
        return root == null ? SchemaSnapshot.empty() : decode(layout.schemaSnapshotFile(), root, SchemaSnapshot::fromMap);
    }

    public CatalogSnapshot loadCatalogSnapshot() throws IOException {
        final Map<String, Object> root = read(layout.catalogSnapshotFile());
        return root == null ? CatalogSnapshot.empty() : decode(layout.catalogSnapshotFile(), root, CatalogSnapshot::fromMap);
    }

    public void saveSchemaSnapshot(final SchemaSnapshot snapshot) throws IOException {
        write(layout.schemaSnapshotFile(), Objects.requireNonNull(snapshot, "snapshot").toMap());
    }

    public void saveCatalogSnapshot(final CatalogSnapshot snapshot) throws IOException {
        write(layout.catalogSnapshotFile(), Objects.requireNonNull(snapshot, "snapshot").toMap());
    }

    private static Map<String, Object> read(final Path path) throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        final String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (final IOException exception) {
            throw new IOException("reading " + path + ": " + exception.getMessage(), exception);
        }
        try {
            return JsonValues.parseObject(content);
        } catch (final IllegalArgumentException exception) {
            throw new IOException("parsing " + path + ": " + exception.getMessage(), exception);
        }
    }

    private static <T> T decode(
            final Path path,
            final Map<String, Object> root,
            final Function<Map<String, Object>, T> decoder) throws IOException {
        try {
            return decoder.apply(root);
        } catch (final IllegalArgumentException exception) {
            throw new IOException("parsing " + path + ": " + exception.getMessage(), exception);
        }
    }

    private static void write(final Path path, final Map<String, Object> root) throws IOException {
        createDirectories(path.getParent());
        try {
            Files.writeString(path, JsonEncoder.encodePretty(root) + "\n", StandardCharsets.UTF_8);
        } catch (final IOException exception) {
            throw new IOException("writing " + path + ": " + exception.getMessage(), exception);
        }
    }

    private static void createDirectories(final Path directory) throws IOException {
        try {
            Files.createDirectories(directory);
        } catch (final IOException exception) {
            throw new IOException("creating " + directory + ": " + exception.getMessage(), exception);
        }
    }
}
