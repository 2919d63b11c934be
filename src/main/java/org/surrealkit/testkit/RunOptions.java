package org.surrealkit.testkit;

/**
 * Switches for one test run.
 *
 * @param parallel maximum suites in flight; values below 2 run suites sequentially
 * @param baseUrl explicit API base URL, overriding config and environment
 * @param timeoutMs explicit API request timeout, overriding config and environment
 */
public record RunOptions(
        boolean failFast,
        int parallel,
        boolean keepDatabases,
        boolean runSetup,
        boolean runSync,
        boolean runSeed,
        String baseUrl,
        Long timeoutMs) {

    public RunOptions {
        if (parallel < 1) {
            parallel = 1;
        }
    }

    public static RunOptions defaults() {
        return new RunOptions(false, 1, false, true, true, true, null, null);
    }

    public boolean parallelEnabled() {
        return parallel > 1;
    }

    public RunOptions withFailFast(final boolean value) {
        return new RunOptions(value, parallel, keepDatabases, runSetup, runSync, runSeed, baseUrl, timeoutMs);
    }

    public RunOptions withParallel(final int value) {
        return new RunOptions(failFast, value, keepDatabases, runSetup, runSync, runSeed, baseUrl, timeoutMs);
    }

    public RunOptions withKeepDatabases(final boolean value) {
        return new RunOptions(failFast, parallel, value, runSetup, runSync, runSeed, baseUrl, timeoutMs);
    }

    /**
     * Skips setup, sync and seed; suites then start from an empty database.
     */
    public RunOptions withoutPreparation() {
        return new RunOptions(failFast, parallel, keepDatabases, false, false, false, baseUrl, timeoutMs);
    }

    public RunOptions withPreparation(final boolean setup, final boolean sync, final boolean seed) {
        return new RunOptions(failFast, parallel, keepDatabases, setup, sync, seed, baseUrl, timeoutMs);
    }

    public RunOptions withApi(final String url, final Long timeout) {
        return new RunOptions(failFast, parallel, keepDatabases, runSetup, runSync, runSeed, url, timeout);
    }
}
