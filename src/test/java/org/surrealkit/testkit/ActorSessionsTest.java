package org.surrealkit.testkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.surrealkit.client.Credentials;
import org.surrealkit.client.FakeDatabaseClient;
import org.surrealkit.client.QueryExecutionException;
import org.surrealkit.config.ConfigurationException;
import org.surrealkit.config.DatabaseSettings;

class ActorSessionsTest {
    private static final DatabaseSettings SETTINGS =
            new DatabaseSettings("http://localhost:8000", "app", "main", "root", "secret");

    @Test
    void defaultRootUsesOperatorCredentials() {
        final FakeDatabaseClient.Server server = new FakeDatabaseClient.Server();

        try (ActorSessions sessions = ActorSessions.open(server, SETTINGS, "ns_t", "db_t", Map.of(), Map.of())) {
            final FakeDatabaseClient client = assertInstanceOf(FakeDatabaseClient.class, sessions.root().client());
            assertEquals(Credentials.root("root", "secret"), client.credentials());
            assertEquals("ns_t", client.namespace());
            assertEquals("db_t", client.database());
            assertEquals("http://localhost:8000", client.address());
            assertEquals(Map.of(), sessions.root().headers());
            assertEquals(List.of(ActorSessions.ROOT), sessions.names());
        }
        assertTrue(server.connections().get(0).closed());
    }

    @Test
    void recordActorResolvesAccessFromEnvironmentAndCarriesBearerHeader() {
        final FakeDatabaseClient.Server server = new FakeDatabaseClient.Server();
        final ActorSpec alice = new ActorSpec(ActorKind.RECORD, null, null, null, null, null, null, null, null,
                null, "APP_ACCESS", Map.of("email", "alice@example.com"), null, null, Map.of("x-tenant", "t1"));

        try (ActorSessions sessions = ActorSessions.open(
                server, SETTINGS, "ns_t", "db_t", Map.of("alice", alice), Map.of("APP_ACCESS", "account"))) {
            final ActorSession session = sessions.require("alice");
            final FakeDatabaseClient client = assertInstanceOf(FakeDatabaseClient.class, session.client());
            assertEquals(
                    Credentials.record("ns_t", "db_t", "account", Map.of("email", "alice@example.com")),
                    client.credentials());
            assertEquals(Map.of("authorization", "Bearer token-record", "x-tenant", "t1"), session.headers());
        }
    }

    @Test
    void explicitAuthorizationHeaderWins() {
        final ActorSpec gateway = new ActorSpec(ActorKind.HEADERS, null, null, null, null, null, null, null, null,
                null, null, null, null, null, Map.of("Authorization", "Bearer custom"));

        try (ActorSessions sessions = ActorSessions.open(
                new FakeDatabaseClient.Server(), SETTINGS, "ns", "db", Map.of("gateway", gateway), Map.of())) {
            assertEquals(Map.of("Authorization", "Bearer custom"), sessions.require("gateway").headers());
        }
    }

    @Test
    void tokenActorAuthenticatesWithoutSignin() {
        final ActorSpec service = new ActorSpec(ActorKind.TOKEN, null, null, null, null, "other_ns", null, null, null,
                null, null, null, null, "SERVICE_TOKEN", null);

        try (ActorSessions sessions = ActorSessions.open(new FakeDatabaseClient.Server(), SETTINGS, "ns", "db",
                Map.of("service", service), Map.of("SERVICE_TOKEN", "jwt-123"))) {
            final ActorSession session = sessions.require("service");
            final FakeDatabaseClient client = assertInstanceOf(FakeDatabaseClient.class, session.client());
            assertEquals("jwt-123", client.token());
            assertNull(client.credentials());
            assertEquals("other_ns", client.namespace());
            assertEquals(Map.of("authorization", "Bearer jwt-123"), session.headers());
        }
    }

    @Test
    void missingCredentialFailsBeforeConnectingAndClosesRoot() {
        final FakeDatabaseClient.Server server = new FakeDatabaseClient.Server();
        final ActorSpec dbUser = new ActorSpec(ActorKind.DATABASE, null, null, "pw", null, null, null, null, null,
                null, null, null, null, null, null);

        final ConfigurationException error = assertThrows(ConfigurationException.class, () -> ActorSessions.open(
                server, SETTINGS, "ns", "db", Map.of("db_user", dbUser), Map.of()));

        assertEquals("missing actor 'db_user' database username", error.getMessage());
        assertEquals(1, server.connections().size());
        assertTrue(server.connections().get(0).closed());
    }

    @Test
    void unsetEnvironmentVariableIsNamed() {
        final ActorSpec service = new ActorSpec(ActorKind.TOKEN, null, null, null, null, null, null, null, null,
                null, null, null, null, "SERVICE_TOKEN", null);

        final ConfigurationException error = assertThrows(ConfigurationException.class, () -> ActorSessions.open(
                new FakeDatabaseClient.Server(), SETTINGS, "ns", "db", Map.of("service", service), Map.of()));

        assertEquals("missing actor 'service' token: environment variable SERVICE_TOKEN is not set", error.getMessage());
    }

    @Test
    void declaredRootReplacesDefaultRoot() {
        final FakeDatabaseClient.Server server = new FakeDatabaseClient.Server();
        final ActorSpec root = new ActorSpec(ActorKind.ROOT, "admin", null, null, "ADMIN_PASS", null, null, null, null,
                null, null, null, null, null, null);

        try (ActorSessions sessions = ActorSessions.open(
                server, SETTINGS, "ns", "db", Map.of("root", root), Map.of("ADMIN_PASS", "hunter2"))) {
            final FakeDatabaseClient client = assertInstanceOf(FakeDatabaseClient.class, sessions.root().client());
            assertEquals(Credentials.root("admin", "hunter2"), client.credentials());
            assertEquals(Map.of("authorization", "Bearer token-root"), sessions.root().headers());
        }
        assertTrue(server.connections().get(0).closed());
    }

    @Test
    void signinFailureIsWrappedWithContext() {
        final FakeDatabaseClient.Server server = new FakeDatabaseClient.Server().failSignin("invalid credentials");

        final QueryExecutionException error = assertThrows(QueryExecutionException.class,
                () -> ActorSessions.open(server, SETTINGS, "ns", "db", Map.of(), Map.of()));

        assertEquals("root actor setup for ns=ns db=db: invalid credentials", error.getMessage());
        assertTrue(server.connections().get(0).closed());
    }

    @Test
    void suiteActorsOverrideGlobalActors() {
        final ActorSpec globalAlice = ActorSpec.ofKind(ActorKind.ROOT);
        final ActorSpec suiteAlice = ActorSpec.ofKind(ActorKind.HEADERS);
        final ActorSpec bob = ActorSpec.ofKind(ActorKind.ROOT);

        final Map<String, ActorSpec> merged = ActorSessions.merge(
                Map.of("alice", globalAlice, "bob", bob), Map.of("alice", suiteAlice));

        assertEquals(Map.of("alice", suiteAlice, "bob", bob), merged);
    }

    @Test
    void unknownActorIsAConfigurationError() {
        try (ActorSessions sessions = ActorSessions.open(
                new FakeDatabaseClient.Server(), SETTINGS, "ns", "db", Map.of(), Map.of())) {
            final ConfigurationException error = assertThrows(ConfigurationException.class, () -> sessions.require("ghost"));
            assertEquals("actor 'ghost' not configured", error.getMessage());
        }
    }
}
