package org.surrealkit.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.surrealkit.client.Credentials;
import org.surrealkit.client.DatabaseClient;
import org.surrealkit.client.DatabaseClientFactory;
import org.surrealkit.client.HttpTransport;
import org.surrealkit.client.JdkHttpTransport;
import org.surrealkit.client.QueryExecutionException;
import org.surrealkit.client.SurrealHttpClient;
import org.surrealkit.config.DatabaseSettings;
import org.surrealkit.config.ProjectLayout;
import org.surrealkit.obs.CorrelationContext;
import org.surrealkit.obs.JsonLinesLogger;
import org.surrealkit.obs.StructuredJsonLinesLogger;
import org.surrealkit.sync.BootstrapSchema;
import org.surrealkit.sync.MigrationLedger;
import org.surrealkit.sync.MigrationOutcome;
import org.surrealkit.sync.MigrationRecord;
import org.surrealkit.sync.MigrationRunner;
import org.surrealkit.sync.MigrationSummary;
import org.surrealkit.sync.SeedApplier;
import org.surrealkit.sync.SyncOptions;
import org.surrealkit.sync.SyncPassResult;
import org.surrealkit.sync.SyncReconciler;
import org.surrealkit.sync.WatchLoop;
import org.surrealkit.testkit.LoadedSpecs;
import org.surrealkit.testkit.LoadedSuite;
import org.surrealkit.testkit.ReportRenderer;
import org.surrealkit.testkit.RunOptions;
import org.surrealkit.testkit.RunReport;
import org.surrealkit.testkit.SpecLoader;
import org.surrealkit.testkit.SuiteFilter;
import org.surrealkit.testkit.TestRunner;

/**
 * Command line entry point for schema setup, migration, sync, seeding and declarative tests.
 */
public final class SurrealKitTool {
    private static final Set<String> COMMANDS = Set.of("setup", "migrate", "sync", "seed", "status", "apply", "test");

    private SurrealKitTool() {}

    public static void main(final String[] args) {
        final int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        return run(args, out, err, ToolEnvironment.system(err));
    }

    static int run(
            final String[] args,
            final PrintStream out,
            final PrintStream err,
            final ToolEnvironment environment) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");
        Objects.requireNonNull(environment, "environment");

        final Config config;
        try {
            config = parseArgs(args);
        } catch (final IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 2;
        }

        if (config.help()) {
            printUsage(out);
            return 0;
        }

        try {
            final DatabaseSettings settings = DatabaseSettings.fromEnvironment(environment.variables());
            final ProjectLayout layout = ProjectLayout.at(environment.projectRoot());
            if ("test".equals(config.command())) {
                return runTests(config, settings, layout, environment, out);
            }
            try (DatabaseClient client = connect(environment.clients(), settings)) {
                return runCommand(config, client, layout, environment, out);
            }
        } catch (final IOException | RuntimeException e) {
            err.println("surrealkit " + config.command() + " failed: " + e.getMessage());
            return 1;
        }
    }

    private static int runCommand(
            final Config config,
            final DatabaseClient client,
            final ProjectLayout layout,
            final ToolEnvironment environment,
            final PrintStream out) throws IOException {
        final JsonLinesLogger logger = environment.logger();
        final CorrelationContext correlation = CorrelationContext.of(
                TestRunner.newRunId(environment.clock()), config.command());
        switch (config.command()) {
            case "setup" -> {
                new BootstrapSchema(layout).ensure(client);
                out.println("Setup complete");
                return 0;
            }
            case "seed" -> {
                new SeedApplier(layout).apply(client);
                out.println("Seed applied");
                return 0;
            }
            case "status" -> {
                final List<MigrationRecord> records = migrationRunner(client, layout, environment, correlation).status();
                if (records.isEmpty()) {
                    out.println("No migrations recorded");
                } else {
                    out.println("Applied migrations:");
                    for (final MigrationRecord record : records) {
                        out.println(record.appliedAt() + " " + record.id() + " " + record.file());
                    }
                }
                return 0;
            }
            case "apply" -> {
                final Path path = environment.projectRoot().resolve(config.applyPath());
                final MigrationOutcome outcome =
                        migrationRunner(client, layout, environment, correlation).applyPath(path, config.track());
                out.println(outcome.value() + " " + layout.relativize(path));
                return 0;
            }
            case "migrate" -> {
                final MigrationSummary summary = migrationRunner(client, layout, environment, correlation)
                        .migrateAll(config.failFast(), config.dryRun());
                for (final MigrationOutcome outcome : MigrationOutcome.values()) {
                    for (final String path : summary.paths(outcome)) {
                        out.println(outcome.value() + " " + path);
                    }
                }
                out.println("Migrations: " + summary.count(MigrationOutcome.APPLIED) + " applied, "
                        + summary.count(MigrationOutcome.SKIPPED) + " skipped, "
                        + summary.count(MigrationOutcome.PLANNED) + " planned, "
                        + summary.count(MigrationOutcome.FAILED) + " failed");
                return summary.hasFailures() ? 1 : 0;
            }
            case "sync" -> {
                return runSync(config, client, layout, environment, correlation, out);
            }
            default -> throw new IllegalStateException("unhandled command: " + config.command());
        }
    }

    private static int runSync(
            final Config config,
            final DatabaseClient client,
            final ProjectLayout layout,
            final ToolEnvironment environment,
            final CorrelationContext correlation,
            final PrintStream out) throws IOException {
        final SyncOptions options = SyncOptions.defaults()
                .withDryRun(config.dryRun())
                .withFailFast(config.failFast())
                .withPrune(config.prune())
                .withAllowSharedPrune(config.allowSharedPrune());
        if (!config.dryRun()) {
            // tracking tables must exist before the first pass reads them
            new BootstrapSchema(layout).ensure(client);
        }
        final SyncReconciler reconciler = new SyncReconciler(
                client, layout, environment.variables(), environment.clock(), environment.logger(), correlation);
        if (!config.watch()) {
            final SyncPassResult result = reconciler.runOnce(options);
            out.println(result.hasChanges()
                    ? "Sync: " + result.changedFiles() + " changed file(s), " + result.applyErrors()
                            + " apply error(s), " + result.staleEntities().size() + " stale, "
                            + result.prunedEntities() + " pruned"
                    : "schema already in sync");
            for (final String statement : result.pruneStatements()) {
                out.println("  " + statement);
            }
            return 0;
        }

        final WatchLoop loop = new WatchLoop(
                reconciler, options, Duration.ofMillis(config.intervalMs()), environment.logger(), correlation);
        final Thread hook = new Thread(loop::cancel, "surrealkit-watch-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        out.println("Watching " + layout.relativize(layout.schemaDir()) + " (Ctrl+C to stop)");
        try {
            loop.run();
        } finally {
            removeHook(hook);
        }
        out.println("Stopping schema watch.");
        return 0;
    }

    private static int runTests(
            final Config config,
            final DatabaseSettings settings,
            final ProjectLayout layout,
            final ToolEnvironment environment,
            final PrintStream out) throws IOException {
        final LoadedSpecs specs = SpecLoader.load(layout);
        final List<LoadedSuite> suites = SuiteFilter.apply(
                specs.suites(),
                new SuiteFilter.FilterInput(config.suitePattern(), config.casePattern(), config.tags()));
        if (suites.isEmpty()) {
            throw new IllegalStateException("No suites matched the selected filters");
        }
        final RunOptions options = RunOptions.defaults()
                .withFailFast(config.failFast())
                .withParallel(config.parallel())
                .withKeepDatabases(config.keepDatabases())
                .withPreparation(config.setup(), config.sync(), config.seed())
                .withApi(config.baseUrl(), config.timeoutMs());
        final TestRunner runner = new TestRunner(
                environment.clients(), environment.transport(), settings, layout,
                environment.variables(), environment.clock(), environment.logger());
        final RunReport report = runner.run(specs.global(), suites, options);

        out.print(ReportRenderer.toHumanText(report));
        if (config.jsonOut() != null) {
            ReportRenderer.writeJson(environment.projectRoot().resolve(config.jsonOut()), report);
        }
        if (!report.successful()) {
            out.println(report.casesFailed() + " test cases failed");
            return 1;
        }
        return 0;
    }

    private static MigrationRunner migrationRunner(
            final DatabaseClient client,
            final ProjectLayout layout,
            final ToolEnvironment environment,
            final CorrelationContext correlation) {
        return new MigrationRunner(
                client, layout, new BootstrapSchema(layout), new MigrationLedger(client, environment.clock()),
                environment.logger(), correlation);
    }

    /**
     * Connects as the configured root user and selects the configured namespace and database.
     */
    static DatabaseClient connect(final DatabaseClientFactory clients, final DatabaseSettings settings) {
        final DatabaseClient client = clients.connect(settings.host());
        try {
            client.signin(Credentials.root(settings.username(), settings.password()));
            client.use(settings.namespace(), settings.database());
            return client;
        } catch (final QueryExecutionException e) {
            client.close();
            throw QueryExecutionException.wrap("connecting to " + settings.host(), e);
        }
    }

    /**
     * Returns {@code false} when the JVM is already shutting down and runs the hook itself.
     */
    private static boolean removeHook(final Thread hook) {
        try {
            return Runtime.getRuntime().removeShutdownHook(hook);
        } catch (final IllegalStateException shuttingDown) {
            return false;
        }
    }

    private static Config parseArgs(final String[] args) {
        final Config.Builder builder = new Config.Builder();
        for (final String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                builder.help = true;
                continue;
            }
            if (!arg.startsWith("--")) {
                if (builder.command == null) {
                    if (!COMMANDS.contains(arg)) {
                        throw new IllegalArgumentException("unknown command: " + arg);
                    }
                    builder.command = arg;
                } else if ("apply".equals(builder.command) && builder.applyPath == null) {
                    builder.applyPath = arg;
                } else {
                    throw new IllegalArgumentException("unexpected argument: " + arg);
                }
                continue;
            }
            builder.option(arg);
        }

        if (builder.help) {
            return builder.build();
        }
        if (builder.command == null) {
            throw new IllegalArgumentException("a command is required");
        }
        if ("apply".equals(builder.command) && builder.applyPath == null) {
            throw new IllegalArgumentException("apply requires a file path");
        }
        builder.checkOptionsFor(builder.command);
        return builder.build();
    }

    private static String valueAfterPrefix(final String arg, final String prefix) {
        final String value = arg.substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException(prefix + " must have a value");
        }
        return value;
    }

    private static long parsePositiveLong(final String arg, final String prefix) {
        final String raw = valueAfterPrefix(arg, prefix);
        try {
            final long value = Long.parseLong(raw);
            if (value < 1) {
                throw new IllegalArgumentException(prefix + " must be positive");
            }
            return value;
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(prefix + " must be an integer: " + raw, e);
        }
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: surrealkit <command> [options]");
        stream.println("Commands:");
        stream.println("  setup                       Run database/setup.surql and create tracking tables");
        stream.println("  migrate [--no-fail-fast] [--dry-run]");
        stream.println("                              Apply untracked files from database/migrations");
        stream.println("  sync [--watch] [--interval-ms=N] [--dry-run] [--fail-fast] [--no-prune]");
        stream.println("       [--allow-shared-prune] Reconcile database/schema with the database");
        stream.println("  seed                        Run database/seed.surql");
        stream.println("  status                      List applied migrations");
        stream.println("  apply <file> [--track]      Execute one file, recording it only with --track");
        stream.println("  test [--suite=<glob>] [--case=<glob>] [--tag=<tag>]... [--fail-fast]");
        stream.println("       [--parallel=N] [--json-out=<path>] [--no-setup] [--no-sync] [--no-seed]");
        stream.println("       [--base-url=<url>] [--timeout-ms=N] [--keep-db]");
        stream.println("                              Run declarative suites from database/tests/suites");
        stream.println("  --help                      Show usage");
    }

    private record Config(
            String command,
            boolean help,
            String applyPath,
            boolean track,
            boolean failFast,
            boolean dryRun,
            boolean watch,
            long intervalMs,
            boolean prune,
            boolean allowSharedPrune,
            String suitePattern,
            String casePattern,
            List<String> tags,
            int parallel,
            String jsonOut,
            boolean setup,
            boolean sync,
            boolean seed,
            String baseUrl,
            Long timeoutMs,
            boolean keepDatabases) {

        private static final class Builder {
            private String command;
            private boolean help;
            private String applyPath;
            private boolean track;
            private Boolean failFast;
            private boolean dryRun;
            private boolean watch;
            private long intervalMs = WatchLoop.MINIMUM_INTERVAL.toMillis();
            private boolean prune = true;
            private boolean allowSharedPrune;
            private String suitePattern;
            private String casePattern;
            private final List<String> tags = new ArrayList<>();
            private int parallel = 1;
            private String jsonOut;
            private boolean setup = true;
            private boolean sync = true;
            private boolean seed = true;
            private String baseUrl;
            private Long timeoutMs;
            private boolean keepDatabases;
            private final List<String> seen = new ArrayList<>();

            void option(final String arg) {
                final int equals = arg.indexOf('=');
                seen.add(equals < 0 ? arg : arg.substring(0, equals + 1));
                switch (equals < 0 ? arg : arg.substring(0, equals + 1)) {
                    case "--track" -> track = true;
                    case "--fail-fast" -> failFast = Boolean.TRUE;
                    case "--no-fail-fast" -> failFast = Boolean.FALSE;
                    case "--dry-run" -> dryRun = true;
                    case "--watch" -> watch = true;
                    case "--interval-ms=" -> intervalMs = parsePositiveLong(arg, "--interval-ms=");
                    case "--no-prune" -> prune = false;
                    case "--allow-shared-prune" -> allowSharedPrune = true;
                    case "--suite=" -> suitePattern = valueAfterPrefix(arg, "--suite=");
                    case "--case=" -> casePattern = valueAfterPrefix(arg, "--case=");
                    case "--tag=" -> tags.add(valueAfterPrefix(arg, "--tag="));
                    case "--parallel=" -> parallel = (int) Math.min(Integer.MAX_VALUE, parsePositiveLong(arg, "--parallel="));
                    case "--json-out=" -> jsonOut = valueAfterPrefix(arg, "--json-out=");
                    case "--no-setup" -> setup = false;
                    case "--no-sync" -> sync = false;
                    case "--no-seed" -> seed = false;
                    case "--base-url=" -> baseUrl = valueAfterPrefix(arg, "--base-url=");
                    case "--timeout-ms=" -> timeoutMs = parsePositiveLong(arg, "--timeout-ms=");
                    case "--keep-db" -> keepDatabases = true;
                    default -> throw new IllegalArgumentException("unknown argument: " + arg);
                }
            }

            void checkOptionsFor(final String commandName) {
                final Set<String> allowed = switch (commandName) {
                    case "migrate" -> Set.of("--fail-fast", "--no-fail-fast", "--dry-run");
                    case "sync" -> Set.of("--watch", "--interval-ms=", "--dry-run", "--fail-fast",
                            "--no-fail-fast", "--no-prune", "--allow-shared-prune");
                    case "apply" -> Set.of("--track");
                    case "test" -> Set.of("--suite=", "--case=", "--tag=", "--fail-fast", "--parallel=",
                            "--json-out=", "--no-setup", "--no-sync", "--no-seed", "--base-url=",
                            "--timeout-ms=", "--keep-db");
                    default -> Set.of();
                };
                for (final String option : seen) {
                    if (!allowed.contains(option)) {
                        throw new IllegalArgumentException(option + " is not valid for " + commandName);
                    }
                }
            }

            Config build() {
                // migrate stops at the first failure unless told otherwise; sync and test continue
                final boolean effectiveFailFast = failFast != null ? failFast : "migrate".equals(command);
                return new Config(command, help, applyPath, track, effectiveFailFast, dryRun, watch, intervalMs,
                        prune, allowSharedPrune, suitePattern, casePattern, List.copyOf(tags), parallel, jsonOut,
                        setup, sync, seed, baseUrl, timeoutMs, keepDatabases);
            }
        }
    }

    /**
     * Process-level collaborators, replaceable in tests.
     */
    record ToolEnvironment(
            Map<String, String> variables,
            Path projectRoot,
            DatabaseClientFactory clients,
            HttpTransport transport,
            Clock clock,
            JsonLinesLogger logger) {

        ToolEnvironment {
            variables = Map.copyOf(Objects.requireNonNull(variables, "variables"));
            Objects.requireNonNull(projectRoot, "projectRoot");
            Objects.requireNonNull(clients, "clients");
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(logger, "logger");
        }

        static ToolEnvironment system(final PrintStream err) {
            final HttpTransport transport = new JdkHttpTransport();
            final Clock clock = Clock.systemUTC();
            return new ToolEnvironment(
                    System.getenv(),
                    Path.of("").toAbsolutePath(),
                    SurrealHttpClient.factory(transport),
                    transport,
                    clock,
                    StructuredJsonLinesLogger.shared(err, clock));
        }
    }
}
