package org.surrealkit.sync;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import org.surrealkit.client.DatabaseClient;
import org.surrealkit.client.QueryExecutionException;
import org.surrealkit.config.ProjectLayout;

public final class SeedApplier {
    private final ProjectLayout layout;

    public SeedApplier(final ProjectLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    /**
     * Executes {@code database/seed.surql}.
     *
     * @throws NoSuchFileException when the seed file does not exist
     */
    public void apply(final DatabaseClient client) throws IOException {
        Objects.requireNonNull(client, "client");
        final Path seedFile = layout.seedFile();
        if (!Files.exists(seedFile)) {
            throw new NoSuchFileException(seedFile.toString(), null, "seed file not found");
        }
        final String sql = Files.readString(seedFile, StandardCharsets.UTF_8);
        try {
            client.executeChecked(sql);
        } catch (final QueryExecutionException exception) {
            throw QueryExecutionException.wrap("applying seed " + layout.relativize(seedFile), exception);
        }
    }
}
