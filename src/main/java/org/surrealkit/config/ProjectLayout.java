package org.surrealkit.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Fixed on-disk layout of a project's database directory, relative to a project root.
 */
public record ProjectLayout(Path root) {
    public static final String SCHEMA_EXTENSION = ".surql";

    public ProjectLayout {
        root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public static ProjectLayout at(final Path root) {
        return new ProjectLayout(root);
    }

    public Path databaseDir() {
        return root.resolve("database");
    }

    public Path schemaDir() {
        return databaseDir().resolve("schema");
    }

    public Path migrationsDir() {
        return databaseDir().resolve("migrations");
    }

    public Path stateDir() {
        return databaseDir().resolve(".surrealkit");
    }

    public Path schemaSnapshotFile() {
        return stateDir().resolve("schema_snapshot.json");
    }

    public Path catalogSnapshotFile() {
        return stateDir().resolve("catalog_snapshot.json");
    }

    public Path setupFile() {
        return databaseDir().resolve("setup.surql");
    }

    public Path seedFile() {
        return databaseDir().resolve("seed.surql");
    }

    public Path testsDir() {
        return databaseDir().resolve("tests");
    }

    public Path suitesDir() {
        return testsDir().resolve("suites");
    }

    /**
     * Global test config; the first existing of {@code config.toml}, {@code config.yaml},
     * {@code config.yml}, {@code config.json}, defaulting to {@code config.yaml}.
     */
    public Path testConfigFile() {
        for (final String candidate : new String[] {"config.toml", "config.yaml", "config.yml", "config.json"}) {
            final Path path = testsDir().resolve(candidate);
            if (path.toFile().isFile()) {
                return path;
            }
        }
        return testsDir().resolve("config.yaml");
    }

    /**
     * Project-relative, forward-slash form of {@code path}; paths outside the root are returned
     * as given.
     */
    public String relativize(final Path path) {
        final Path absolute = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        final Path relative = absolute.startsWith(root) ? root.relativize(absolute) : path;
        return relative.toString().replace('\\', '/');
    }
}
