package org.surrealkit.testkit;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import org.surrealkit.client.DatabaseClientFactory;
import org.surrealkit.client.HttpTransport;
import org.surrealkit.config.DatabaseSettings;
import org.surrealkit.config.ProjectLayout;
import org.surrealkit.config.TestDefaults;
import org.surrealkit.obs.CorrelationContext;
import org.surrealkit.obs.JsonLinesLogger;

/**
 * Runs loaded suites sequentially or with bounded parallelism and folds the results into a
 * {@link RunReport}.
 *
 * <p>Under fail-fast, the first failed suite stops admission of further suites and asks running
 * suites to stop between cases. Suites stopped that way are left out of the report; settled ones
 * are kept and sorted by path.
 */
public final class TestRunner {
    private final DatabaseClientFactory clients;
    private final HttpTransport transport;
    private final DatabaseSettings settings;
    private final ProjectLayout layout;
    private final Map<String, String> environment;
    private final Clock clock;
    private final JsonLinesLogger logger;

    public TestRunner(
            final DatabaseClientFactory clients,
            final HttpTransport transport,
            final DatabaseSettings settings,
            final ProjectLayout layout,
            final Map<String, String> environment,
            final Clock clock,
            final JsonLinesLogger logger) {
        this.clients = Objects.requireNonNull(clients, "clients");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Run identifier used in isolated namespace/database names: the clock's epoch time in
     * nanoseconds.
     */
    public static String newRunId(final Clock clock) {
        final Instant now = clock.instant();
        return Long.toString(now.getEpochSecond() * 1_000_000_000L + now.getNano());
    }

    public RunReport run(final GlobalTestConfig global, final List<LoadedSuite> suites, final RunOptions options) {
        return run(newRunId(clock), global, suites, options);
    }

    public RunReport run(
            final String runId,
            final GlobalTestConfig global,
            final List<LoadedSuite> suites,
            final RunOptions options) {
        Objects.requireNonNull(global, "global");
        Objects.requireNonNull(suites, "suites");
        Objects.requireNonNull(options, "options");
        final Instant startedAt = clock.instant();
        final long started = System.nanoTime();
        final CorrelationContext correlation = CorrelationContext.of(runId, "test");

        final String baseUrl = TestDefaults.resolveBaseUrl(options.baseUrl(), global.baseUrl(), environment)
                .orElse(null);
        final long timeoutMs = TestDefaults.resolveTimeoutMs(options.timeoutMs(), global.timeoutMs(), environment);
        final SuiteRunner suiteRunner = new SuiteRunner(
                clients, new ApiRequestExecutor(transport), settings, layout, environment, global, options,
                baseUrl, timeoutMs, clock, logger, correlation);

        logger.info("test run started", correlation, Map.of("suites", suites.size(), "parallel", options.parallel()));
        final List<SuiteReport> reports = options.parallelEnabled()
                ? runParallel(suiteRunner, suites, options)
                : runSequential(suiteRunner, suites, options);

        final RunReport report = new RunReport(
                runId, startedAt, clock.instant(), (System.nanoTime() - started) / 1_000_000L, reports);
        logger.info("test run finished", correlation, Map.of(
                "suitesTotal", report.suitesTotal(),
                "suitesFailed", report.suitesFailed(),
                "casesFailed", report.casesFailed()));
        return report;
    }

    private static List<SuiteReport> runSequential(
            final SuiteRunner runner,
            final List<LoadedSuite> suites,
            final RunOptions options) {
        final List<SuiteReport> reports = new ArrayList<>();
        for (final LoadedSuite suite : suites) {
            final Optional<SuiteReport> report = runner.run(suite, () -> false);
            if (report.isEmpty()) {
                continue;
            }
            reports.add(report.get());
            if (options.failFast() && report.get().failed()) {
                break;
            }
        }
        return reports;
    }

    private static List<SuiteReport> runParallel(
            final SuiteRunner runner,
            final List<LoadedSuite> suites,
            final RunOptions options) {
        final int limit = options.parallel();
        final Semaphore slots = new Semaphore(limit);
        final AtomicBoolean cancelled = new AtomicBoolean();
        final ExecutorService pool = Executors.newFixedThreadPool(limit, runnable -> {
            final Thread thread = new Thread(runnable, "surrealkit-suite");
            thread.setDaemon(true);
            return thread;
        });
        final CompletionService<Optional<SuiteReport>> completion = new ExecutorCompletionService<>(pool);
        final List<SuiteReport> reports = new ArrayList<>();
        int submitted = 0;
        try {
            for (final LoadedSuite suite : suites) {
                try {
                    slots.acquire();
                } catch (final InterruptedException exception) {
                    Thread.currentThread().interrupt();
                    cancelled.set(true);
                    break;
                }
                if (cancelled.get()) {
                    slots.release();
                    break;
                }
                completion.submit(() -> {
                    try {
                        final Optional<SuiteReport> report = runner.run(suite, cancelled::get);
                        if (options.failFast() && report.map(SuiteReport::failed).orElse(false)) {
                            cancelled.set(true);
                        }
                        return report;
                    } finally {
                        slots.release();
                    }
                });
                submitted++;
            }
            for (int i = 0; i < submitted; i++) {
                collect(completion, reports);
            }
        } finally {
            pool.shutdown();
        }
        reports.sort(Comparator.comparing(SuiteReport::suiteFile));
        return reports;
    }

    private static void collect(
            final CompletionService<Optional<SuiteReport>> completion,
            final List<SuiteReport> reports) {
        try {
            completion.take().get().ifPresent(reports::add);
        } catch (final InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for suites", exception);
        } catch (final ExecutionException exception) {
            throw new IllegalStateException("suite task failed: " + exception.getCause(), exception.getCause());
        }
    }
}
