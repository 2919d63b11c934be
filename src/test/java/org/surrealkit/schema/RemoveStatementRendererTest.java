package org.surrealkit.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class RemoveStatementRendererTest {
    @Test
    void rendersScopedAndUnscopedEntities() {
        final List<String> statements = RemoveStatementRenderer.render(List.of(
                EntityKey.of(EntityKind.TABLE, "person"),
                EntityKey.scoped(EntityKind.FIELD, "person", "name"),
                EntityKey.scoped(EntityKind.ACCESS, "DATABASE", "account"),
                EntityKey.of(EntityKind.USER, "admin"),
                EntityKey.of(EntityKind.FUNCTION, "fn::greet")), false);

        assertEquals(List.of(
                "REMOVE TABLE person;",
                "REMOVE FIELD name ON person;",
                "REMOVE ACCESS account ON DATABASE;",
                "REMOVE USER admin;",
                "REMOVE FUNCTION fn::greet;"), statements);
    }

    @Test
    void unknownKindsAreSkipped() {
        assertEquals(
                List.of("REMOVE TABLE t;"),
                RemoveStatementRenderer.render(List.of(
                        new EntityKey("sequence", null, "counter"),
                        EntityKey.of(EntityKind.TABLE, "t")), false));
    }

    @Test
    void staleApiRequiresServerSupport() {
        final List<EntityKey> entities = List.of(EntityKey.of(EntityKind.API, "/users"));

        assertEquals(List.of("REMOVE API /users;"), RemoveStatementRenderer.render(entities, true));
        final CapabilityException error = assertThrows(
                CapabilityException.class, () -> RemoveStatementRenderer.render(entities, false));
        assertTrue(error.getMessage().contains("--no-prune"));
    }

    @Test
    void requiredScopeMissingIsRejected() {
        final EntityKey orphan = new EntityKey("index", null, "email_idx");

        final MissingScopeException error = assertThrows(
                MissingScopeException.class, () -> RemoveStatementRenderer.render(List.of(orphan), true));
        assertEquals(orphan, error.entity());
    }
}
