package org.surrealkit.testkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.surrealkit.client.FakeDatabaseClient;
import org.surrealkit.client.HttpResult;
import org.surrealkit.client.QueryResponse;
import org.surrealkit.client.StatementResult;
import org.surrealkit.config.DatabaseSettings;
import org.surrealkit.config.ProjectLayout;
import org.surrealkit.obs.RecordingLogger;

class TestRunnerTest {
    private static final DatabaseSettings SETTINGS =
            new DatabaseSettings("http://localhost:8000", "app", "main", "root", "secret");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final RunOptions NO_PREP = RunOptions.defaults().withoutPreparation();

    @TempDir
    Path tempDir;

    private ProjectLayout layout;
    private FakeDatabaseClient.Server server;
    private RecordingLogger logger;

    @BeforeEach
    void setUp() {
        layout = ProjectLayout.at(tempDir);
        server = new FakeDatabaseClient.Server().failOn("FAIL", "boom");
        logger = new RecordingLogger();
    }

    @Test
    void runIdIsEpochNanoseconds() {
        assertEquals("1772359200000000000", TestRunner.newRunId(CLOCK));
    }

    @Test
    void eachSuiteRunsInItsOwnDatabaseAndIsCleanedUp() {
        final RunReport report = runner().run("run1", GlobalTestConfig.empty(),
                List.of(suite("users", "RETURN 1;", "RETURN 2;")), NO_PREP);

        final SuiteReport suite = report.suites().get(0);
        assertEquals("app_sk_test_run1_users_database_tests_suites_users_yaml", suite.namespace());
        assertEquals("main_sk_test_run1_users_database_tests_suites_users_yaml", suite.database());
        assertTrue(report.successful());
        assertEquals(2, report.casesPassed());
        assertTrue(server.statements().contains("REMOVE DATABASE main_sk_test_run1_users_database_tests_suites_users_yaml;"));
        assertTrue(server.connections().stream().allMatch(FakeDatabaseClient::closed));
        assertTrue(logger.hasMessage("INFO", "test run finished"));
    }

    @Test
    void keepDatabasesSkipsCleanup() {
        runner().run("run1", GlobalTestConfig.empty(), List.of(suite("users", "RETURN 1;")),
                NO_PREP.withKeepDatabases(true));

        assertTrue(server.statements().stream().noneMatch(statement -> statement.startsWith("REMOVE DATABASE")));
    }

    @Test
    void failFastStopsRemainingCasesAndSuites() {
        final RunReport report = runner().run("run1", GlobalTestConfig.empty(),
                List.of(suite("a", "FAIL;", "RETURN 1;"), suite("b", "RETURN 2;")), NO_PREP.withFailFast(true));

        assertEquals(1, report.suitesTotal());
        assertEquals(List.of("case_1"), report.suites().get(0).cases().stream().map(CaseReport::name).toList());
        assertFalse(server.statements().contains("RETURN 2;"));
    }

    @Test
    void withoutFailFastEverySuiteAndCaseRuns() {
        final RunReport report = runner().run("run1", GlobalTestConfig.empty(),
                List.of(suite("a", "FAIL;", "RETURN 1;"), suite("b", "RETURN 2;")), NO_PREP);

        assertEquals(2, report.suitesTotal());
        assertEquals(1, report.suitesFailed());
        assertEquals(3, report.casesTotal());
        assertEquals(1, report.casesFailed());
    }

    @Test
    void preparationRunsSetupSyncSeedAndFixturesInOrder() throws IOException {
        Files.createDirectories(layout.schemaDir());
        Files.writeString(layout.schemaDir().resolve("person.surql"), "DEFINE TABLE person;", StandardCharsets.UTF_8);
        Files.writeString(layout.seedFile(), "CREATE person:seed;", StandardCharsets.UTF_8);
        final GlobalTestConfig global = new GlobalTestConfig(null, null, Map.of(),
                List.of(new FixtureSpec("global", null, "CREATE person:fixture;", null)));

        final RunReport report = runner().run("run1", global, List.of(suite("users", "SELECT * FROM person;")),
                RunOptions.defaults());

        assertTrue(report.successful());
        final List<String> statements = server.statements();
        final int schema = statements.indexOf("DEFINE TABLE person;");
        final int seed = statements.indexOf("CREATE person:seed;");
        final int fixture = statements.indexOf("CREATE person:fixture;");
        final int testCase = statements.indexOf("SELECT * FROM person;");
        assertTrue(schema >= 0 && schema < seed && seed < fixture && fixture < testCase);
        assertTrue(Files.exists(layout.setupFile()));
        assertFalse(Files.exists(layout.schemaSnapshotFile()));
    }

    @Test
    void preparationFailureBecomesSetupCase() {
        final RunReport report = runner().run("run1", GlobalTestConfig.empty(),
                List.of(suite("users", "RETURN 1;")), RunOptions.defaults().withPreparation(false, false, true));

        final SuiteReport suite = report.suites().get(0);
        assertEquals(1, suite.casesTotal());
        assertEquals(SuiteRunner.SETUP_CASE, suite.cases().get(0).name());
        assertEquals("setup", suite.cases().get(0).kind());
        assertTrue(server.statements().stream().anyMatch(statement -> statement.startsWith("REMOVE DATABASE")));
    }

    @Test
    void parallelRunReportsSuitesSortedByPath() {
        final RunReport report = runner().run("run1", GlobalTestConfig.empty(),
                List.of(suite("c", "RETURN 3;"), suite("a", "RETURN 1;"), suite("b", "FAIL;")),
                NO_PREP.withParallel(2));

        assertEquals(
                List.of("database/tests/suites/a.yaml", "database/tests/suites/b.yaml", "database/tests/suites/c.yaml"),
                report.suites().stream().map(SuiteReport::suiteFile).toList());
        assertEquals(1, report.casesFailed());
    }

    @Test
    void parallelFailFastLeavesCancelledSuitesOut() {
        final CountDownLatch failedSuiteCleaned = new CountDownLatch(1);
        server.respond("REMOVE DATABASE main_sk_test_run1_a_", (statement, bindings) -> {
            failedSuiteCleaned.countDown();
            return QueryResponse.of(StatementResult.success(List.of()));
        });
        server.respond("SLOW", (statement, bindings) -> {
            try {
                failedSuiteCleaned.await(10, TimeUnit.SECONDS);
                Thread.sleep(300);
            } catch (final InterruptedException exception) {
                Thread.currentThread().interrupt();
            }
            return QueryResponse.of(StatementResult.success(List.of()));
        });

        final RunReport report = runner().run("run1", GlobalTestConfig.empty(),
                List.of(suite("a", "FAIL;"), suite("b", "SLOW;", "RETURN 2;"), suite("c", "RETURN 3;")),
                NO_PREP.withParallel(2).withFailFast(true));

        assertEquals(List.of("database/tests/suites/a.yaml"),
                report.suites().stream().map(SuiteReport::suiteFile).toList());
        assertFalse(report.successful());
        assertFalse(server.statements().contains("RETURN 2;"));
        assertFalse(server.statements().contains("RETURN 3;"));
    }

    private TestRunner runner() {
        return new TestRunner(server, call -> new HttpResult(200, Map.of(), "{}"), SETTINGS, layout, Map.of(),
                CLOCK, logger);
    }

    private LoadedSuite suite(final String name, final String... statements) {
        final List<CaseSpec> cases = new ArrayList<>();
        for (int i = 0; i < statements.length; i++) {
            cases.add(new CaseSpec("case_" + (i + 1), List.of(),
                    new SqlExpectCase(null, statements[i], true, null, null, List.of())));
        }
        return new LoadedSuite("database/tests/suites/" + name + ".yaml", layout.suitesDir(),
                new SuiteSpec(name, List.of(), Map.of(), List.of(), cases));
    }
}
