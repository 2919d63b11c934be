package org.surrealkit.testkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.surrealkit.config.ConfigurationException;
import org.surrealkit.config.ProjectLayout;

class SpecLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void parsesEveryCaseKind() {
        final SuiteSpec suite = SpecLoader.parseSuite("""
                name: users
                tags: [smoke]
                cases:
                  - name: anonymous_cannot_select
                    kind: sql_expect
                    actor: anon
                    sql: SELECT * FROM user;
                    allow: false
                    error_contains: permission
                  - name: user_matrix
                    kind: permissions_matrix
                    actor: alice
                    table: user
                    rules:
                      - action: select
                        allow: true
                      - action: delete
                        allow: false
                  - name: user_table_info
                    kind: schema_metadata
                    table: user
                    contains: ["email"]
                  - name: email_is_unique
                    kind: schema_behavior
                    setup_sql: ["CREATE user:1 SET email = 'a@x';"]
                    action_sql: CREATE user:2 SET email = 'a@x';
                    expect_success: false
                    expect_error_contains: already contains
                  - name: health
                    kind: api_request
                    path: /health
                    expected_status: 200
                    body: null
                    body_assertions:
                      - path: status
                        equals: ok
                    header_assertions:
                      - name: content-type
                        contains: json
                """, "users.yaml");

        assertEquals("users", suite.name());
        assertEquals(List.of("smoke"), suite.tags());
        assertEquals(
                List.of("sql_expect", "permissions_matrix", "schema_metadata", "schema_behavior", "api_request"),
                suite.cases().stream().map(CaseSpec::kind).toList());

        final SqlExpectCase sqlExpect = assertInstanceOf(SqlExpectCase.class, suite.cases().get(0).definition());
        assertFalse(sqlExpect.allow());
        assertEquals("permission", sqlExpect.errorContains());
        assertEquals("anon", sqlExpect.actorOrDefault());

        final PermissionsMatrixCase matrix = assertInstanceOf(PermissionsMatrixCase.class, suite.cases().get(1).definition());
        assertEquals(PermissionsMatrixCase.DEFAULT_RECORD_ID, matrix.recordId());
        assertEquals(List.of(PermissionAction.SELECT, PermissionAction.DELETE),
                matrix.rules().stream().map(PermissionRule::action).toList());

        final ApiRequestCase api = assertInstanceOf(ApiRequestCase.class, suite.cases().get(4).definition());
        assertEquals("GET", api.method());
        assertEquals(200, api.expectedStatus());
        assertTrue(api.bodyPresent());
        assertNull(api.body());
        assertEquals("ok", api.bodyAssertions().get(0).equalTo());
        assertEquals(ActorSessions.ROOT, api.actorOrDefault());
    }

    @Test
    void unknownFieldsAreRejectedWithTheirPath() {
        final SpecValidationException error = assertThrows(SpecValidationException.class, () -> SpecLoader.parseSuite("""
                cases:
                  - name: typo
                    kind: sql_expect
                    sql: RETURN 1;
                    alow: false
                """, "typo.yaml"));

        assertEquals(List.of("typo.yaml: unknown field cases[0].alow"), error.errors());
    }

    @Test
    void reportsEveryIssueInOneError() {
        final SpecValidationException error = assertThrows(SpecValidationException.class, () -> SpecLoader.parseSuite("""
                fixtures:
                  - name: both
                    sql: RETURN 1;
                    file: seed.surql
                cases:
                  - name: missing_kind
                  - kind: api_request
                    name: bad_status
                    path: /x
                    expected_status: 42
                """, "broken.yaml"));

        assertTrue(error.errors().contains("broken.yaml: fixtures[0] requires exactly one of sql or file"));
        assertTrue(error.errors().contains("broken.yaml: cases[0].kind is required"));
        assertTrue(error.errors().contains("broken.yaml: cases[1].expected_status must be an HTTP status code"));
    }

    @Test
    void unsupportedEnumValuesAreReported() {
        final SpecValidationException error = assertThrows(SpecValidationException.class, () -> SpecLoader.parseGlobal("""
                actors:
                  ghost:
                    kind: wizard
                """, "config.yaml"));

        assertEquals(List.of("config.yaml: actors.ghost.kind: unsupported actor kind: wizard"), error.errors());
    }

    @Test
    void malformedDocumentIsAParseError() {
        final SpecValidationException error = assertThrows(
                SpecValidationException.class, () -> SpecLoader.parseSuite("{\"cases\": [", "bad.json"));

        assertTrue(error.errors().get(0).startsWith("bad.json: parse error: "));
    }

    @Test
    void globalConfigCarriesDefaultsActorsAndFixtures() {
        final GlobalTestConfig config = SpecLoader.parseGlobal("""
                {"defaults": {"base_url": "http://localhost:3000", "timeout_ms": 5000},
                 "actors": {"alice": {"kind": "record", "access": "account", "params": {"email": "a@x"},
                                      "headers": {"x-tenant": "t1"}}},
                 "fixtures": [{"name": "users", "actor": "alice", "file": "fixtures/users.surql"}]}
                """, "config.json");

        assertEquals("http://localhost:3000", config.baseUrl());
        assertEquals(5000L, config.timeoutMs());
        final ActorSpec alice = config.actors().get("alice");
        assertEquals(ActorKind.RECORD, alice.kind());
        assertEquals(Map.of("email", "a@x"), alice.params());
        assertEquals(Map.of("x-tenant", "t1"), alice.headers());
        assertFalse(config.fixtures().get(0).targetsRoot());
    }

    @Test
    void loadDiscoversSuitesRecursivelyInPathOrder() throws IOException {
        final ProjectLayout layout = ProjectLayout.at(tempDir);
        writeSuite(layout.suitesDir().resolve("zeta.yaml"), "cases: [{name: z, kind: sql_expect, sql: 'RETURN 1;'}]");
        writeSuite(layout.suitesDir().resolve("nested/alpha.json"),
                "{\"cases\": [{\"name\": \"a\", \"kind\": \"sql_expect\", \"sql\": \"RETURN 1;\"}]}");
        writeSuite(layout.suitesDir().resolve("notes.txt"), "ignored");

        final LoadedSpecs specs = SpecLoader.load(layout);

        assertEquals(GlobalTestConfig.empty(), specs.global());
        assertEquals(
                List.of("database/tests/suites/nested/alpha.json", "database/tests/suites/zeta.yaml"),
                specs.suites().stream().map(LoadedSuite::path).toList());
        assertEquals(layout.suitesDir().resolve("nested"), specs.suites().get(0).directory());
    }

    @Test
    void parsesTomlSuites() {
        final SuiteSpec suite = SpecLoader.parseSuite("""
                name = "users"
                tags = ["smoke"]

                [[cases]]
                name = "anonymous_cannot_select"
                kind = "sql_expect"
                actor = "anon"
                sql = "SELECT * FROM user;"
                allow = false

                [[cases]]
                name = "health"
                kind = "api_request"
                path = "/health"
                expected_status = 200

                [[cases.body_assertions]]
                path = "status"
                equals = "ok"
                """, "users.toml");

        assertEquals("users", suite.name());
        assertEquals(List.of("smoke"), suite.tags());
        final SqlExpectCase sqlExpect = assertInstanceOf(SqlExpectCase.class, suite.cases().get(0).definition());
        assertFalse(sqlExpect.allow());
        final ApiRequestCase api = assertInstanceOf(ApiRequestCase.class, suite.cases().get(1).definition());
        assertEquals(200, api.expectedStatus());
        assertEquals("ok", api.bodyAssertions().get(0).equalTo());
    }

    @Test
    void unknownTomlKeysAreRejectedWithTheirPath() {
        final SpecValidationException error = assertThrows(SpecValidationException.class, () -> SpecLoader.parseSuite("""
                [[cases]]
                name = "typo"
                kind = "sql_expect"
                sql = "RETURN 1;"
                alow = false
                """, "typo.toml"));

        assertEquals(List.of("typo.toml: unknown field cases[0].alow"), error.errors());
    }

    @Test
    void malformedTomlIsAParseError() {
        final SpecValidationException error = assertThrows(
                SpecValidationException.class, () -> SpecLoader.parseSuite("name = \"unterminated\n", "bad.toml"));

        assertFalse(error.errors().isEmpty());
        assertTrue(error.errors().get(0).startsWith("bad.toml: parse error: "));
    }

    @Test
    void loadReadsTomlConfigAndSuites() throws IOException {
        final ProjectLayout layout = ProjectLayout.at(tempDir);
        writeSuite(layout.testsDir().resolve("config.toml"), """
                [defaults]
                base_url = "http://localhost:3000"
                timeout_ms = 2500
                """);
        writeSuite(layout.suitesDir().resolve("users.toml"), """
                [[cases]]
                name = "one"
                kind = "sql_expect"
                sql = "RETURN 1;"
                """);

        final LoadedSpecs specs = SpecLoader.load(layout);

        assertEquals("http://localhost:3000", specs.global().baseUrl());
        assertEquals(2500L, specs.global().timeoutMs());
        assertEquals(List.of("database/tests/suites/users.toml"),
                specs.suites().stream().map(LoadedSuite::path).toList());
    }

    @Test
    void noSuitesIsAConfigurationError() throws IOException {
        final ProjectLayout layout = ProjectLayout.at(tempDir);
        Files.createDirectories(layout.suitesDir());

        final ConfigurationException error = assertThrows(ConfigurationException.class, () -> SpecLoader.load(layout));
        assertEquals("no suite files found in database/tests/suites", error.getMessage());
    }

    private static void writeSuite(final Path file, final String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
