package org.surrealkit.testkit;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.surrealkit.client.DatabaseClient;
import org.surrealkit.client.QueryExecutionException;
import org.surrealkit.client.QueryResponse;
import org.surrealkit.client.StatementResult;
import org.surrealkit.config.ConfigurationException;
import org.surrealkit.json.JsonEncoder;

/**
 * Runs single cases against a suite's actor sessions. Any exception raised while running a case
 * becomes a failed report; nothing escapes {@link #run(CaseSpec)}.
 */
final class CaseExecutor {
    private static final String OUTCOME = "outcome";
    private static final String SUCCEEDED = "query succeeded as expected";
    private static final String FAILED_AS_EXPECTED = "query failed as expected";
    private static final String UNEXPECTED_SUCCESS = "expected failure, query succeeded";

    private final ActorSessions sessions;
    private final ApiRequestExecutor api;
    private final String baseUrl;
    private final long timeoutMs;

    CaseExecutor(
            final ActorSessions sessions,
            final ApiRequestExecutor api,
            final String baseUrl,
            final long timeoutMs) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.api = Objects.requireNonNull(api, "api");
        this.baseUrl = baseUrl;
        this.timeoutMs = timeoutMs;
    }

    CaseReport run(final CaseSpec testCase) {
        final long started = System.nanoTime();
        CaseReport report;
        try {
            report = dispatch(testCase);
        } catch (final IOException | RuntimeException exception) {
            report = CaseReport.error(testCase, describe(exception), 0L);
        }
        return report.withDuration((System.nanoTime() - started) / 1_000_000L);
    }

    private CaseReport dispatch(final CaseSpec testCase) throws IOException {
        final CaseDefinition definition = testCase.definition();
        if (definition instanceof SqlExpectCase sqlExpect) {
            return runSqlExpect(testCase, sqlExpect);
        }
        if (definition instanceof PermissionsMatrixCase matrix) {
            return runPermissionsMatrix(testCase, matrix);
        }
        if (definition instanceof SchemaMetadataCase metadata) {
            return runSchemaMetadata(testCase, metadata);
        }
        if (definition instanceof SchemaBehaviorCase behavior) {
            return runSchemaBehavior(testCase, behavior);
        }
        if (definition instanceof ApiRequestCase request) {
            return runApiRequest(testCase, request);
        }
        throw new IllegalArgumentException("unsupported case kind: " + definition.label());
    }

    private CaseReport runSqlExpect(final CaseSpec testCase, final SqlExpectCase spec) {
        final DatabaseClient client = sessions.require(spec.actorOrDefault()).client();
        final StatementResult result = executeSql(client, spec.sql());
        return expectOutcome(testCase, result, spec.allow(), spec.errorContains(), spec.errorCode(), spec.assertions());
    }

    private CaseReport runPermissionsMatrix(final CaseSpec testCase, final PermissionsMatrixCase spec) {
        if (spec.rules().isEmpty()) {
            throw new ConfigurationException("permissions_matrix case '" + testCase.name() + "' has no rules");
        }
        final DatabaseClient actor = sessions.require(spec.actorOrDefault()).client();
        final DatabaseClient root = sessions.root().client();
        final String record = spec.table() + ":" + spec.recordId();

        final List<AssertionReport> assertions = new ArrayList<>();
        for (int i = 0; i < spec.rules().size(); i++) {
            final PermissionRule rule = spec.rules().get(i);
            // seed errors are ignored
            executeSql(root, "UPSERT " + record + " MERGE { __surrealkit_perm_seed: true };");
            final String sql = switch (rule.action()) {
                case CREATE -> "CREATE " + record + "_create_" + i + " CONTENT { marker: 'perm' };";
                case SELECT -> "SELECT * FROM " + record + ";";
                case UPDATE -> "UPDATE " + record + " SET marker = 'updated_" + i + "';";
                case DELETE -> "DELETE " + record + ";";
                case QUERY -> {
                    if (rule.sql() == null || rule.sql().isBlank()) {
                        throw new ConfigurationException(
                                "permissions_matrix action=query in '" + testCase.name() + "' requires sql");
                    }
                    yield rule.sql();
                }
            };
            final AssertionReport verdict =
                    evaluateOutcome("rule_" + (i + 1), executeSql(actor, sql), rule.allow(), rule.errorContains(), null);
            assertions.add(verdict.passed()
                    ? verdict
                    : AssertionReport.fail(verdict.name(), verdict.message() + "; sql=" + sql));
        }
        return CaseReport.fromAssertions(testCase, assertions, "one or more permission rules failed");
    }

    private CaseReport runSchemaMetadata(final CaseSpec testCase, final SchemaMetadataCase spec) {
        final DatabaseClient client = sessions.require(spec.actorOrDefault()).client();
        final String sql;
        if (spec.sql() != null && !spec.sql().isBlank()) {
            sql = spec.sql();
        } else if (spec.table() != null && !spec.table().isBlank()) {
            sql = "INFO FOR TABLE " + spec.table() + ";";
        } else {
            throw new ConfigurationException("schema_metadata requires either table or sql");
        }
        final Object value = queryValue(client, sql);
        final String text = JsonEncoder.encode(value);

        final List<AssertionReport> assertions = new ArrayList<>();
        for (int i = 0; i < spec.contains().size(); i++) {
            final String needle = spec.contains().get(i);
            assertions.add(new AssertionReport(
                    "contains_" + (i + 1),
                    text.contains(needle),
                    "expected metadata to contain '" + needle + "'"));
        }
        for (int i = 0; i < spec.assertions().size(); i++) {
            assertions.add(AssertionEvaluator.evaluateJson(value, spec.assertions().get(i), i));
        }
        return CaseReport.fromAssertions(testCase, assertions, "schema metadata assertions failed");
    }

    private CaseReport runSchemaBehavior(final CaseSpec testCase, final SchemaBehaviorCase spec) {
        final DatabaseClient client = sessions.require(spec.actorOrDefault()).client();
        for (final String setup : spec.setupSql()) {
            try {
                queryValue(client, setup);
            } catch (final QueryExecutionException exception) {
                throw QueryExecutionException.wrap(
                        "schema_behavior setup failed in case '" + testCase.name() + "'", exception);
            }
        }
        final StatementResult action = executeSql(client, spec.actionSql());
        final CaseReport report = expectOutcome(
                testCase, action, spec.expectSuccess(), spec.expectErrorContains(), null, List.of());
        if (!report.passed() || spec.assertions().isEmpty()) {
            return report;
        }
        final String verifySql = spec.verifySql() == null || spec.verifySql().isBlank()
                ? spec.actionSql()
                : spec.verifySql();
        final Object value = queryValue(client, verifySql);
        final List<AssertionReport> assertions = new ArrayList<>(report.assertions());
        for (int i = 0; i < spec.assertions().size(); i++) {
            assertions.add(AssertionEvaluator.evaluateJson(value, spec.assertions().get(i), i));
        }
        return CaseReport.fromAssertions(testCase, assertions, "schema behavior assertions failed");
    }

    private CaseReport runApiRequest(final CaseSpec testCase, final ApiRequestCase spec) throws IOException {
        final ActorSession actor = sessions.require(spec.actorOrDefault());
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigurationException("api_request case '" + testCase.name()
                    + "' requires base URL (--base-url, config default, or env)");
        }
        final ApiRequestExecutor.ApiOutcome outcome = api.execute(baseUrl, spec, actor.headers(), timeoutMs);
        return CaseReport.fromAssertions(
                testCase, outcome.assertions(), "api assertions failed (status=" + outcome.status() + ")");
    }

    private static CaseReport expectOutcome(
            final CaseSpec testCase,
            final StatementResult result,
            final boolean allow,
            final String errorContains,
            final String errorCode,
            final List<JsonAssertionSpec> jsonAssertions) {
        final AssertionReport outcome = evaluateOutcome(OUTCOME, result, allow, errorContains, errorCode);
        if (!outcome.passed()) {
            return new CaseReport(testCase.name(), testCase.kind(), 0L, false, outcome.message(), List.of(outcome));
        }
        final List<AssertionReport> assertions = new ArrayList<>();
        assertions.add(outcome);
        if (allow) {
            for (int i = 0; i < jsonAssertions.size(); i++) {
                assertions.add(AssertionEvaluator.evaluateJson(result.result(), jsonAssertions.get(i), i));
            }
        }
        return CaseReport.fromAssertions(testCase, assertions, "one or more assertions failed");
    }

    static AssertionReport evaluateOutcome(
            final String label,
            final StatementResult result,
            final boolean allow,
            final String errorContains,
            final String errorCode) {
        if (allow) {
            return result.ok()
                    ? AssertionReport.pass(label, SUCCEEDED)
                    : AssertionReport.fail(label, "expected success, got error: " + result.error());
        }
        if (result.ok()) {
            return AssertionReport.fail(label, UNEXPECTED_SUCCESS);
        }
        final String text = result.error();
        final boolean containsOk = errorContains == null || text.contains(errorContains);
        final boolean codeOk = errorCode == null || text.contains(errorCode);
        return containsOk && codeOk
                ? AssertionReport.pass(label, FAILED_AS_EXPECTED)
                : AssertionReport.fail(label, "error mismatch, got '" + text + "'");
    }

    /**
     * First statement's value, or a failure carrying the error text of the first failing
     * statement or of the transport.
     */
    static StatementResult executeSql(final DatabaseClient client, final String sql) {
        try {
            return StatementResult.success(queryValue(client, sql));
        } catch (final QueryExecutionException exception) {
            return StatementResult.failure(String.valueOf(exception.getMessage()));
        }
    }

    private static String describe(final Exception exception) {
        return exception.getMessage() == null ? exception.getClass().getSimpleName() : exception.getMessage();
    }

    private static Object queryValue(final DatabaseClient client, final String sql) {
        final QueryResponse response = client.execute(sql).check();
        return response.size() == 0 ? null : response.take(0);
    }
}
