package org.surrealkit.sync;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.surrealkit.client.DatabaseClient;
import org.surrealkit.client.QueryExecutionException;
import org.surrealkit.config.DatabaseSettings;
import org.surrealkit.config.ProjectLayout;
import org.surrealkit.obs.CorrelationContext;
import org.surrealkit.obs.JsonLinesLogger;
import org.surrealkit.schema.CatalogExtractor;
import org.surrealkit.schema.CatalogSnapshot;
import org.surrealkit.schema.EntityKey;
import org.surrealkit.schema.EntityKind;
import org.surrealkit.schema.FileDiff;
import org.surrealkit.schema.RemoveStatementRenderer;
import org.surrealkit.schema.SchemaDiff;
import org.surrealkit.schema.SchemaFile;
import org.surrealkit.schema.SchemaFiles;
import org.surrealkit.schema.SchemaSnapshot;
import org.surrealkit.schema.SnapshotStore;

/**
 * Brings the live schema in line with the schema directory: applies files whose tracked hash
 * differs, then optionally prunes entities that disappeared from every file.
 */
public final class SyncReconciler {
    private final DatabaseClient client;
    private final ProjectLayout layout;
    private final SnapshotStore snapshots;
    private final TrackingRepository<String> hashes;
    private final TrackingRepository<Object> metadata;
    private final Map<String, String> environment;
    private final Clock clock;
    private final JsonLinesLogger logger;
    private final CorrelationContext correlation;

    public SyncReconciler(
            final DatabaseClient client,
            final ProjectLayout layout,
            final Map<String, String> environment,
            final Clock clock,
            final JsonLinesLogger logger,
            final CorrelationContext correlation) {
        this(client, layout, new SnapshotStore(layout), new SyncHashRepository(client),
                new SyncMetadataRepository(client), environment, clock, logger, correlation);
    }

    SyncReconciler(
            final DatabaseClient client,
            final ProjectLayout layout,
            final SnapshotStore snapshots,
            final TrackingRepository<String> hashes,
            final TrackingRepository<Object> metadata,
            final Map<String, String> environment,
            final Clock clock,
            final JsonLinesLogger logger,
            final CorrelationContext correlation) {
        this.client = Objects.requireNonNull(client, "client");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.hashes = Objects.requireNonNull(hashes, "hashes");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.correlation = Objects.requireNonNull(correlation, "correlation");
    }

    /**
     * Runs one pass.
     *
     * @throws QueryExecutionException on the first apply error when fail-fast is set, or when
     *     pruning or metadata writes fail
     * @throws SharedDatabaseException when stale entities would be pruned from a shared database
     */
    public SyncPassResult runOnce(final SyncOptions options) throws IOException {
        Objects.requireNonNull(options, "options");
        final List<SchemaFile> files = SchemaFiles.collect(layout, layout.schemaDir());
        final SchemaSnapshot currentFiles = SchemaSnapshot.fromFiles(files);
        final FileDiff fileDiff = SchemaDiff.diff(snapshots.loadSchemaSnapshot(), currentFiles);
        final Map<String, String> tracked = hashes.all();

        final List<String> changed = new ArrayList<>();
        int applyErrors = 0;
        for (final SchemaFile file : files) {
            if (file.hash().equals(tracked.get(file.path()))) {
                continue;
            }
            changed.add(file.path());
            final CorrelationContext fileContext = correlation.withPath(file.path());
            if (options.dryRun()) {
                logger.info("dry run: would apply schema file", fileContext);
                continue;
            }
            try {
                client.executeChecked(file.sql());
                hashes.upsert(file.path(), file.hash());
                logger.info("applied schema file", fileContext, Map.of("hash", file.hash()));
            } catch (final QueryExecutionException exception) {
                applyErrors++;
                logger.error("schema file failed", fileContext, Map.of("error", String.valueOf(exception.getMessage())));
                if (options.failFast()) {
                    throw QueryExecutionException.wrap("applying " + file.path(), exception);
                }
            }
        }

        final CatalogSnapshot currentCatalog = CatalogExtractor.buildCatalog(files);
        final List<EntityKey> stale = SchemaDiff.removedEntities(snapshots.loadCatalogSnapshot(), currentCatalog);
        List<String> pruneStatements = List.of();
        int pruned = 0;
        boolean pruneCompleted = false;
        if (options.prune() && !stale.isEmpty()) {
            if (isShared() && !options.allowSharedPrune()) {
                throw new SharedDatabaseException(
                        "database is marked shared; refusing stale prune without --allow-shared-prune");
            }
            pruneStatements = RemoveStatementRenderer.render(stale, apiRemovalSupported(stale));
            if (options.dryRun()) {
                logger.info("dry run: would prune stale entities", correlation,
                        Map.of("statements", pruneStatements));
            } else {
                if (!pruneStatements.isEmpty()) {
                    try {
                        client.executeChecked(String.join("\n", pruneStatements));
                    } catch (final QueryExecutionException exception) {
                        throw QueryExecutionException.wrap("pruning stale entities", exception);
                    }
                    logger.info("pruned stale entities", correlation, Map.of("statements", pruneStatements));
                }
                // unrenderable kinds are dropped from the catalog without a statement
                pruned = pruneStatements.size();
                pruneCompleted = true;
            }
        } else if (!stale.isEmpty()) {
            logger.warn("stale entities detected; rerun without --no-prune to remove", correlation,
                    Map.of("count", stale.size()));
        }

        if (!options.dryRun()) {
            recordMetadata();
            if (options.persistLocalSnapshots()) {
                snapshots.ensureStateDirectories();
                snapshots.saveSchemaSnapshot(currentFiles);
                if (stale.isEmpty() || pruneCompleted) {
                    snapshots.saveCatalogSnapshot(currentCatalog);
                }
            }
        }

        final SyncPassResult result = new SyncPassResult(fileDiff, changed, applyErrors, stale, pruneStatements, pruned);
        if (applyErrors > 0) {
            logger.warn("sync completed with apply errors", correlation, result.toLogFields());
        } else {
            logger.info(result.hasChanges() ? "sync pass completed" : "schema already in sync",
                    correlation, result.toLogFields());
        }
        return result;
    }

    /**
     * The environment override wins over the server-stored flag.
     */
    boolean isShared() {
        final Optional<Boolean> override = DatabaseSettings.parseFlag(environment.get(DatabaseSettings.SHARED_DB_VARIABLE));
        if (override.isPresent()) {
            return override.get();
        }
        return metadata.get(SyncMetadataRepository.SHARED).map(Boolean.TRUE::equals).orElse(false);
    }

    private boolean apiRemovalSupported(final List<EntityKey> stale) {
        for (final EntityKey entity : stale) {
            if (entity.knownKind().filter(kind -> kind == EntityKind.API).isPresent()) {
                return CapabilityProbe.supportsRemoveApi(client);
            }
        }
        return true;
    }

    private void recordMetadata() {
        DatabaseSettings.parseFlag(environment.get(DatabaseSettings.SHARED_DB_VARIABLE))
                .ifPresent(shared -> metadata.upsert(SyncMetadataRepository.SHARED, shared));
        final String owner = environment.get(DatabaseSettings.OWNER_VARIABLE);
        if (owner != null && !owner.isBlank()) {
            metadata.upsert(SyncMetadataRepository.OWNER, owner.trim());
        }
        metadata.upsert(SyncMetadataRepository.LAST_SYNC, Instant.now(clock).toString());
    }
}
