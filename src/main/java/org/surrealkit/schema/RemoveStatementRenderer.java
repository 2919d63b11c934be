package org.surrealkit.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders {@code REMOVE} statements for stale entities.
 */
public final class RemoveStatementRenderer {
    private RemoveStatementRenderer() {}

    /**
     * One statement per entity of a known kind; unknown kinds are skipped.
     *
     * @throws CapabilityException when an api entity is stale and the server cannot remove apis
     * @throws MissingScopeException when a field, event or index has no owning table
     */
    public static List<String> render(final List<EntityKey> entities, final boolean apiRemovalSupported) {
        Objects.requireNonNull(entities, "entities");
        final List<String> statements = new ArrayList<>(entities.size());
        for (final EntityKey entity : entities) {
            final Optional<EntityKind> kind = entity.knownKind();
            if (kind.isEmpty()) {
                continue;
            }
            if (kind.get() == EntityKind.API && !apiRemovalSupported) {
                throw new CapabilityException(
                        "stale api '" + entity.name() + "' cannot be pruned: server does not support REMOVE API;"
                                + " upgrade the server or rerun sync with --no-prune");
            }
            statements.add(renderOne(kind.get(), entity));
        }
        return List.copyOf(statements);
    }

    static String renderOne(final EntityKind kind, final EntityKey entity) {
        final StringBuilder sb = new StringBuilder("REMOVE ").append(kind.keyword()).append(' ').append(entity.name());
        if (kind.scopeRule() == EntityKind.ScopeRule.REQUIRED) {
            sb.append(" ON ").append(entity.scopeValue().orElseThrow(() -> new MissingScopeException(entity)));
        } else if (kind.scopeRule() == EntityKind.ScopeRule.OPTIONAL) {
            entity.scopeValue().ifPresent(scope -> sb.append(" ON ").append(scope));
        }
        return sb.append(';').toString();
    }
}
