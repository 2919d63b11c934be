package org.surrealkit.testkit;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.surrealkit.client.Credentials;
import org.surrealkit.client.DatabaseClient;
import org.surrealkit.client.DatabaseClientFactory;
import org.surrealkit.client.QueryResponse;
import org.surrealkit.config.DatabaseSettings;
import org.surrealkit.config.ProjectLayout;
import org.surrealkit.obs.CorrelationContext;
import org.surrealkit.obs.JsonLinesLogger;
import org.surrealkit.sync.BootstrapSchema;
import org.surrealkit.sync.SeedApplier;
import org.surrealkit.sync.SyncOptions;
import org.surrealkit.sync.SyncReconciler;

/**
 * Runs one suite end to end: prepare an isolated namespace/database, execute the cases in order,
 * then drop the database. Cleanup problems are logged and never change the result.
 */
final class SuiteRunner {
    static final String SETUP_CASE = "suite_setup";

    private final DatabaseClientFactory clients;
    private final ApiRequestExecutor api;
    private final DatabaseSettings settings;
    private final ProjectLayout layout;
    private final Map<String, String> environment;
    private final GlobalTestConfig global;
    private final RunOptions options;
    private final String runId;
    private final String baseUrl;
    private final long timeoutMs;
    private final Clock clock;
    private final JsonLinesLogger logger;
    private final CorrelationContext correlation;

    SuiteRunner(
            final DatabaseClientFactory clients,
            final ApiRequestExecutor api,
            final DatabaseSettings settings,
            final ProjectLayout layout,
            final Map<String, String> environment,
            final GlobalTestConfig global,
            final RunOptions options,
            final String baseUrl,
            final long timeoutMs,
            final Clock clock,
            final JsonLinesLogger logger,
            final CorrelationContext correlation) {
        this.clients = Objects.requireNonNull(clients, "clients");
        this.api = Objects.requireNonNull(api, "api");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.global = Objects.requireNonNull(global, "global");
        this.options = Objects.requireNonNull(options, "options");
        this.baseUrl = baseUrl;
        this.timeoutMs = timeoutMs;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.correlation = Objects.requireNonNull(correlation, "correlation");
        this.runId = correlation.runId();
    }

    /**
     * Runs {@code suite}; empty when {@code cancelled} turned true before the suite settled.
     */
    Optional<SuiteReport> run(final LoadedSuite suite, final BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            return Optional.empty();
        }
        final long started = System.nanoTime();
        final String suiteName = suite.displayName();
        final String slug = slugify(suiteName + "-" + suite.path());
        final String namespace = settings.namespace() + "_sk_test_" + runId + "_" + slug;
        final String database = settings.database() + "_sk_test_" + runId + "_" + slug;
        final CorrelationContext suiteContext = correlation.withSuite(suite.path());

        final List<CaseReport> cases = new ArrayList<>();
        boolean interrupted = false;
        ActorSessions sessions = null;
        try {
            sessions = prepare(suite, namespace, database, suiteContext);
            final CaseExecutor executor = new CaseExecutor(sessions, api, baseUrl, timeoutMs);
            for (final CaseSpec testCase : suite.spec().cases()) {
                if (cancelled.getAsBoolean()) {
                    interrupted = true;
                    break;
                }
                final CaseReport report = executor.run(testCase);
                cases.add(report);
                if (options.failFast() && !report.passed()) {
                    break;
                }
            }
        } catch (final IOException | RuntimeException exception) {
            logger.error("suite preparation failed", suiteContext, Map.of("error", describe(exception)));
            cases.add(new CaseReport(
                    SETUP_CASE,
                    "setup",
                    0L,
                    false,
                    describe(exception),
                    List.of(AssertionReport.fail("error", describe(exception)))));
        } finally {
            closeSessions(sessions, suiteContext);
            if (!options.keepDatabases()) {
                cleanup(namespace, database, suiteContext);
            }
        }
        if (interrupted) {
            return Optional.empty();
        }
        final long durationMs = (System.nanoTime() - started) / 1_000_000L;
        return Optional.of(new SuiteReport(suite.path(), suiteName, namespace, database, durationMs, cases));
    }

    private ActorSessions prepare(
            final LoadedSuite suite,
            final String namespace,
            final String database,
            final CorrelationContext suiteContext) throws IOException {
        final FixtureApplier fixtures = new FixtureApplier(layout.testsDir());
        try (ActorSessions bootstrap = ActorSessions.open(clients, settings, namespace, database, Map.of(), environment)) {
            final DatabaseClient root = bootstrap.root().client();
            if (options.runSetup()) {
                new BootstrapSchema(layout).ensure(root);
            }
            if (options.runSync()) {
                new SyncReconciler(root, layout, environment, clock, logger, suiteContext)
                        .runOnce(SyncOptions.forTestPreparation());
            }
            if (options.runSeed()) {
                new SeedApplier(layout).apply(root);
            }
            fixtures.applyRootTargeted(global.fixtures(), suite, bootstrap);
        }

        final Map<String, ActorSpec> actors = ActorSessions.merge(global.actors(), suite.spec().actors());
        final ActorSessions sessions = ActorSessions.open(clients, settings, namespace, database, actors, environment);
        try {
            fixtures.applyActorTargeted(global.fixtures(), suite, sessions);
        } catch (final IOException | RuntimeException exception) {
            closeSessions(sessions, suiteContext);
            throw exception;
        }
        return sessions;
    }

    private void closeSessions(final ActorSessions sessions, final CorrelationContext suiteContext) {
        if (sessions == null) {
            return;
        }
        try {
            sessions.close();
        } catch (final RuntimeException exception) {
            logger.warn("closing actor sessions failed", suiteContext, Map.of("error", describe(exception)));
        }
    }

    private void cleanup(final String namespace, final String database, final CorrelationContext suiteContext) {
        try (DatabaseClient client = clients.connect(settings.host())) {
            client.signin(Credentials.root(settings.username(), settings.password()));
            client.use(namespace, database);
            final QueryResponse response = client.execute("REMOVE DATABASE " + database + ";");
            response.firstError().ifPresent(error -> logger.warn(
                    "test database cleanup reported an error",
                    suiteContext,
                    Map.of("namespace", namespace, "database", database, "error", error.error())));
        } catch (final RuntimeException exception) {
            logger.warn(
                    "failed to clean up test database",
                    suiteContext,
                    Map.of("namespace", namespace, "database", database, "error", describe(exception)));
        }
    }

    /**
     * Lowercase ASCII alphanumerics with every other run of characters collapsed to one
     * underscore; {@code suite} when nothing remains.
     */
    static String slugify(final String input) {
        final StringBuilder out = new StringBuilder(input.length());
        boolean separator = false;
        for (final char raw : input.toCharArray()) {
            final char c = Character.toLowerCase(raw);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                out.append(c);
                separator = false;
            } else if (!separator) {
                out.append('_');
                separator = true;
            }
        }
        int start = 0;
        int end = out.length();
        while (start < end && out.charAt(start) == '_') {
            start++;
        }
        while (end > start && out.charAt(end - 1) == '_') {
            end--;
        }
        final String slug = out.substring(start, end);
        return slug.isEmpty() ? "suite" : slug.toLowerCase(Locale.ROOT);
    }

    private static String describe(final Exception exception) {
        return exception.getMessage() == null ? exception.getClass().getSimpleName() : exception.getMessage();
    }
}
