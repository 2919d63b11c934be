package org.surrealkit.sync;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.surrealkit.client.DatabaseClient;
import org.surrealkit.client.QueryExecutionException;
import org.surrealkit.config.ProjectLayout;
import org.surrealkit.obs.CorrelationContext;
import org.surrealkit.obs.JsonLinesLogger;
import org.surrealkit.schema.SchemaFile;
import org.surrealkit.schema.SchemaFiles;

/**
 * Applies migration files through the ledger in lexicographic path order.
 */
public final class MigrationRunner {
    private final DatabaseClient client;
    private final ProjectLayout layout;
    private final BootstrapSchema bootstrap;
    private final MigrationLedger ledger;
    private final JsonLinesLogger logger;
    private final CorrelationContext correlation;

    public MigrationRunner(
            final DatabaseClient client,
            final ProjectLayout layout,
            final BootstrapSchema bootstrap,
            final MigrationLedger ledger,
            final JsonLinesLogger logger,
            final CorrelationContext correlation) {
        this.client = Objects.requireNonNull(client, "client");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.correlation = Objects.requireNonNull(correlation, "correlation");
    }

    /**
     * Skips the file when its hash is already in the ledger; otherwise executes it and records it.
     */
    public MigrationOutcome apply(final SchemaFile file) {
        Objects.requireNonNull(file, "file");
        try {
            if (ledger.isApplied(file.hash())) {
                return MigrationOutcome.SKIPPED;
            }
            client.executeChecked(file.sql());
            ledger.record(file.hash(), file.path());
            return MigrationOutcome.APPLIED;
        } catch (final QueryExecutionException exception) {
            throw QueryExecutionException.wrap("applying " + file.path(), exception);
        }
    }

    /**
     * Executes a single file; records it in the ledger only when {@code track} is set.
     */
    public MigrationOutcome applyPath(final Path path, final boolean track) throws IOException {
        final SchemaFile file = SchemaFiles.read(layout, path);
        if (track) {
            return apply(file);
        }
        try {
            client.executeChecked(file.sql());
        } catch (final QueryExecutionException exception) {
            throw QueryExecutionException.wrap("applying " + file.path(), exception);
        }
        return MigrationOutcome.APPLIED;
    }

    public MigrationSummary migrateAll(final boolean failFast, final boolean dryRun) throws IOException {
        bootstrap.ensure(client);
        final List<SchemaFile> files = collectMigrationFiles();
        final Map<String, MigrationOutcome> outcomes = new LinkedHashMap<>();
        if (files.isEmpty()) {
            logger.info("no migration files found", correlation,
                    Map.of("directory", layout.relativize(layout.migrationsDir())));
            return new MigrationSummary(outcomes);
        }

        for (final SchemaFile file : files) {
            final CorrelationContext fileContext = correlation.withPath(file.path());
            if (dryRun) {
                outcomes.put(file.path(), MigrationOutcome.PLANNED);
                logger.info("dry run: would apply migration", fileContext);
                continue;
            }
            try {
                final MigrationOutcome outcome = apply(file);
                outcomes.put(file.path(), outcome);
                logger.info(outcome == MigrationOutcome.APPLIED ? "applied migration" : "skipped migration",
                        fileContext, Map.of("hash", file.hash()));
            } catch (final QueryExecutionException exception) {
                outcomes.put(file.path(), MigrationOutcome.FAILED);
                logger.error("migration failed", fileContext, Map.of("error", String.valueOf(exception.getMessage())));
                if (failFast) {
                    throw exception;
                }
            }
        }
        return new MigrationSummary(outcomes);
    }

    public List<MigrationRecord> status() {
        return ledger.list();
    }

    /**
     * Files under the migrations directory, or the schema directory when that is empty.
     */
    List<SchemaFile> collectMigrationFiles() throws IOException {
        final List<SchemaFile> migrations = SchemaFiles.collect(layout, layout.migrationsDir());
        if (!migrations.isEmpty()) {
            return migrations;
        }
        final List<SchemaFile> legacy = SchemaFiles.collect(layout, layout.schemaDir());
        if (!legacy.isEmpty()) {
            logger.warn("using legacy migration source because the migrations directory is empty", correlation,
                    Map.of("directory", layout.relativize(layout.schemaDir())));
        }
        return legacy;
    }
}
