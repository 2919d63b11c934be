package org.surrealkit.testkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.surrealkit.client.FakeDatabaseClient;
import org.surrealkit.client.HttpCall;
import org.surrealkit.client.HttpResult;
import org.surrealkit.client.QueryResponse;
import org.surrealkit.client.StatementResult;
import org.surrealkit.config.DatabaseSettings;
import org.surrealkit.json.JsonValues;

class CaseExecutorTest {
    private static final DatabaseSettings SETTINGS =
            new DatabaseSettings("http://localhost:8000", "app", "main", "root", "secret");

    private FakeDatabaseClient.Server server;
    private ActorSessions sessions;
    private final List<HttpCall> calls = new ArrayList<>();

    @BeforeEach
    void setUp() {
        server = new FakeDatabaseClient.Server();
        sessions = ActorSessions.open(server, SETTINGS, "ns", "db",
                Map.of("anon", ActorSpec.ofKind(ActorKind.ROOT)), Map.of());
    }

    @AfterEach
    void tearDown() {
        sessions.close();
    }

    @Test
    void deniedQueryPassesWhenErrorMatches() {
        server.failOn("FROM secret", "Not enough permissions to perform this action");

        final CaseReport report = executor(null).run(testCase("denied",
                new SqlExpectCase("anon", "SELECT * FROM secret;", false, "permission", null, List.of())));

        assertTrue(report.passed());
        assertEquals(List.of(AssertionReport.pass("outcome", "query failed as expected")), report.assertions());
    }

    @Test
    void unexpectedSuccessFailsOnOutcomeOnly() {
        final CaseReport report = executor(null).run(testCase("leak",
                new SqlExpectCase("anon", "SELECT * FROM secret;", false, "permission", null,
                        List.of(JsonAssertionSpec.exists("0", true)))));

        assertFalse(report.passed());
        assertEquals("expected failure, query succeeded", report.message());
        assertEquals(1, report.assertions().size());
    }

    @Test
    void allowedQueryRunsJsonAssertionsOnFirstStatement() {
        server.respond("FROM person", QueryResponse.of(
                StatementResult.success(JsonValues.parse("[{\"name\": \"Alice\"}]")),
                StatementResult.success(List.of())));

        final CaseReport report = executor(null).run(testCase("people",
                new SqlExpectCase(null, "SELECT name FROM person; RETURN 1;", true, null, null,
                        List.of(JsonAssertionSpec.equalTo("0.name", "Bob")))));

        assertFalse(report.passed());
        assertEquals("one or more assertions failed", report.message());
        assertEquals("path '0.name' expected \"Bob\", got \"Alice\"", report.assertions().get(1).message());
    }

    @Test
    void errorCodeMismatchIsReported() {
        assertEquals(
                AssertionReport.fail("outcome", "error mismatch, got 'IAM error'"),
                CaseExecutor.evaluateOutcome("outcome", StatementResult.failure("IAM error"), false, null, "E403"));
    }

    @Test
    void permissionsMatrixSeedsAndChecksEveryRule() {
        server.failOn("DELETE user:perm_record", "Not enough permissions");

        final CaseReport report = executor(null).run(testCase("matrix", new PermissionsMatrixCase("anon", "user", null,
                List.of(
                        new PermissionRule(PermissionAction.SELECT, true, null, null),
                        new PermissionRule(PermissionAction.DELETE, true, null, null),
                        new PermissionRule(PermissionAction.QUERY, false, "RETURN 1;", null)))));

        assertFalse(report.passed());
        assertEquals("one or more permission rules failed", report.message());
        assertTrue(report.assertions().get(0).passed());
        assertEquals(
                "expected success, got error: Not enough permissions; sql=DELETE user:perm_record;",
                report.assertions().get(1).message());
        assertEquals("rule_3", report.assertions().get(2).name());
        assertEquals(3, server.statements().stream()
                .filter(statement -> statement.startsWith("UPSERT user:perm_record MERGE")).count());
    }

    @Test
    void queryRuleWithoutSqlIsAnErrorReport() {
        final CaseReport report = executor(null).run(testCase("bad_matrix", new PermissionsMatrixCase(null, "user", "x",
                List.of(new PermissionRule(PermissionAction.QUERY, true, null, null)))));

        assertFalse(report.passed());
        assertEquals("error", report.assertions().get(0).name());
        assertEquals("permissions_matrix action=query in 'bad_matrix' requires sql", report.message());
    }

    @Test
    void schemaMetadataChecksEncodedInfo() {
        server.respond("INFO FOR TABLE person", QueryResponse.of(StatementResult.success(
                JsonValues.parse("{\"fields\": {\"email\": \"DEFINE FIELD email ON person TYPE string\"}}"))));

        final CaseReport report = executor(null).run(testCase("info", new SchemaMetadataCase(null, "person", null,
                List.of("email", "age"), List.of(JsonAssertionSpec.exists("fields.email", true)))));

        assertFalse(report.passed());
        assertEquals(
                List.of(true, false, true),
                report.assertions().stream().map(AssertionReport::passed).toList());
        assertEquals("contains_2", report.assertions().get(1).name());
    }

    @Test
    void schemaBehaviorVerifiesAfterAction() {
        server.respond("SELECT count()", QueryResponse.of(StatementResult.success(JsonValues.parse("[{\"count\": 1}]"))));

        final CaseReport report = executor(null).run(testCase("unique", new SchemaBehaviorCase(null,
                List.of("CREATE user:1 SET email = 'a@x';"), "CREATE user:2 SET email = 'b@x';", true, null,
                "SELECT count() FROM user GROUP ALL;", List.of(JsonAssertionSpec.equalTo("0.count", 1)))));

        assertTrue(report.passed());
        assertEquals(2, report.assertions().size());
    }

    @Test
    void schemaBehaviorSetupFailureIsAnError() {
        server.failOn("CREATE user:1", "already exists");

        final CaseReport report = executor(null).run(testCase("setup", new SchemaBehaviorCase(null,
                List.of("CREATE user:1;"), "RETURN 1;", true, null, null, List.of())));

        assertFalse(report.passed());
        assertEquals("schema_behavior setup failed in case 'setup': already exists", report.message());
    }

    @Test
    void apiRequestNeedsBaseUrl() {
        final CaseReport report = executor(null).run(testCase("health",
                new ApiRequestCase(null, "GET", "/health", 200, null, false, null, null, null, null)));

        assertFalse(report.passed());
        assertTrue(report.message().startsWith("api_request case 'health' requires base URL"));
        assertTrue(calls.isEmpty());
    }

    @Test
    void apiRequestCarriesActorHeaders() {
        final CaseReport report = executor("http://api.test/").run(testCase("health",
                new ApiRequestCase("anon", "GET", "health", 503, null, false, null, null, null, null)));

        assertFalse(report.passed());
        assertEquals("api assertions failed (status=200)", report.message());
        assertEquals("http://api.test/health", calls.get(0).uri().toString());
        assertEquals("Bearer token-root", calls.get(0).headers().get("authorization"));
    }

    @Test
    void unknownActorBecomesFailedReport() {
        final CaseReport report = executor(null).run(testCase("ghost",
                new SqlExpectCase("ghost", "RETURN 1;", true, null, null, List.of())));

        assertFalse(report.passed());
        assertEquals("actor 'ghost' not configured", report.message());
    }

    private CaseExecutor executor(final String baseUrl) {
        final ApiRequestExecutor api = new ApiRequestExecutor(call -> {
            calls.add(call);
            return new HttpResult(200, Map.of("content-type", "application/json"), "{\"status\": \"ok\"}");
        });
        return new CaseExecutor(sessions, api, baseUrl, 1_000L);
    }

    private static CaseSpec testCase(final String name, final CaseDefinition definition) {
        return new CaseSpec(name, List.of(), definition);
    }
}
