package org.surrealkit.sync;

/**
 * Switches for one reconciliation pass.
 *
 * @param persistLocalSnapshots whether a non-dry-run pass rewrites the local snapshot files;
 *     test preparation turns this off so it never disturbs the project's own state
 */
public record SyncOptions(
        boolean dryRun,
        boolean failFast,
        boolean prune,
        boolean allowSharedPrune,
        boolean persistLocalSnapshots) {

    public static SyncOptions defaults() {
        return new SyncOptions(false, false, true, false, true);
    }

    /**
     * Apply-only pass used to prepare an isolated test database.
     */
    public static SyncOptions forTestPreparation() {
        return new SyncOptions(false, true, false, false, false);
    }

    public SyncOptions withDryRun(final boolean value) {
        return new SyncOptions(value, failFast, prune, allowSharedPrune, persistLocalSnapshots);
    }

    public SyncOptions withFailFast(final boolean value) {
        return new SyncOptions(dryRun, value, prune, allowSharedPrune, persistLocalSnapshots);
    }

    public SyncOptions withPrune(final boolean value) {
        return new SyncOptions(dryRun, failFast, value, allowSharedPrune, persistLocalSnapshots);
    }

    public SyncOptions withAllowSharedPrune(final boolean value) {
        return new SyncOptions(dryRun, failFast, prune, value, persistLocalSnapshots);
    }
}
