package org.surrealkit.sync;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.surrealkit.client.DatabaseClient;
import org.surrealkit.client.QueryExecutionException;
import org.surrealkit.config.ProjectLayout;

/**
 * Idempotently defines the tool's own tables: the migration ledger (through the project's
 * {@code setup.surql}) and the sync tracking tables.
 */
public final class BootstrapSchema {
    static final String DEFAULT_SETUP = """
            ---
            --- Migrations: bootstrap _migration table for tracking
            ---
            DEFINE TABLE OVERWRITE _migration SCHEMAFULL
            \tPERMISSIONS NONE;

            DEFINE FIELD OVERWRITE file ON _migration
            \tTYPE string
            \tCOMMENT "Relative path to migration file";

            DEFINE FIELD OVERWRITE applied_at ON _migration
            \tTYPE datetime
            \tDEFAULT time::now();

            DEFINE INDEX OVERWRITE by_file ON _migration
            \tFIELDS file
            \tCOMMENT "Lookup by file name";
            """;

    static final String SYNC_TABLES = """
            DEFINE TABLE OVERWRITE _surrealkit_sync SCHEMAFULL
            \tPERMISSIONS NONE;
            DEFINE FIELD OVERWRITE path ON _surrealkit_sync TYPE string;
            DEFINE FIELD OVERWRITE hash ON _surrealkit_sync TYPE string;
            DEFINE FIELD OVERWRITE synced_at ON _surrealkit_sync TYPE datetime DEFAULT time::now();
            DEFINE INDEX OVERWRITE by_path ON _surrealkit_sync FIELDS path UNIQUE;

            DEFINE TABLE OVERWRITE _surrealkit_sync_meta SCHEMAFULL
            \tPERMISSIONS NONE;
            DEFINE FIELD OVERWRITE key ON _surrealkit_sync_meta TYPE string;
            DEFINE FIELD OVERWRITE value ON _surrealkit_sync_meta TYPE any;
            DEFINE FIELD OVERWRITE updated_at ON _surrealkit_sync_meta TYPE datetime DEFAULT time::now();
            DEFINE INDEX OVERWRITE by_key ON _surrealkit_sync_meta FIELDS key UNIQUE;
            """;

    private final ProjectLayout layout;

    public BootstrapSchema(final ProjectLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    /**
     * Writes the default {@code setup.surql} when missing, then executes it and the sync
     * tracking table definitions.
     */
    public void ensure(final DatabaseClient client) throws IOException {
        Objects.requireNonNull(client, "client");
        final Path setupFile = layout.setupFile();
        if (!Files.exists(setupFile)) {
            try {
                Files.createDirectories(setupFile.getParent());
                Files.writeString(setupFile, DEFAULT_SETUP, StandardCharsets.UTF_8);
            } catch (final IOException exception) {
                throw new IOException("writing " + setupFile + ": " + exception.getMessage(), exception);
            }
        }
        final String sql;
        try {
            sql = Files.readString(setupFile, StandardCharsets.UTF_8);
        } catch (final IOException exception) {
            throw new IOException("reading " + setupFile + ": " + exception.getMessage(), exception);
        }
        try {
            client.executeChecked(sql);
            client.executeChecked(SYNC_TABLES);
        } catch (final QueryExecutionException exception) {
            throw QueryExecutionException.wrap("running setup", exception);
        }
    }
}
