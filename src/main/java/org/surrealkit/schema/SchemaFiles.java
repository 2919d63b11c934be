package org.surrealkit.schema;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.surrealkit.config.ProjectLayout;

/**
 * Discovers {@code .surql} files below a directory.
 */
public final class SchemaFiles {
    private SchemaFiles() {}

    /**
     * Files below {@code directory} (recursive, following links) sorted by project-relative path.
     * A missing directory yields an empty list.
     */
    public static List<SchemaFile> collect(final ProjectLayout layout, final Path directory) throws IOException {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(directory, "directory");
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        final List<Path> paths;
        try (Stream<Path> stream = Files.walk(directory, FileVisitOption.FOLLOW_LINKS)) {
            paths = stream
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(ProjectLayout.SCHEMA_EXTENSION))
                    .collect(Collectors.toList());
        }

        final List<SchemaFile> files = new ArrayList<>(paths.size());
        for (final Path path : paths) {
            files.add(read(layout, path));
        }
        files.sort(Comparator.comparing(SchemaFile::path));
        return List.copyOf(files);
    }

    public static SchemaFile read(final ProjectLayout layout, final Path path) throws IOException {
        final byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (final IOException exception) {
            throw new IOException("reading " + path + ": " + exception.getMessage(), exception);
        }
        return SchemaFile.of(layout.relativize(path), content);
    }
}
