package org.surrealkit.schema;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Structural identity of one schema entity: kind, optional owning scope, name.
 *
 * <p>The kind is kept as text so snapshots written by newer versions with unknown kinds still
 * load; {@link #knownKind()} resolves it. Ordering is (kind, scope with absent first, name).
 */
public record EntityKey(String kind, String scope, String name) implements Comparable<EntityKey> {
    private static final Comparator<EntityKey> ORDER = Comparator
            .comparing(EntityKey::kind)
            .thenComparing(EntityKey::scope, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(EntityKey::name);

    public EntityKey {
        kind = requireText(kind, "kind").toLowerCase(Locale.ROOT);
        scope = scope == null || scope.isBlank() ? null : scope.trim();
        name = requireText(name, "name");
    }

    public static EntityKey of(final EntityKind kind, final String name) {
        return new EntityKey(Objects.requireNonNull(kind, "kind").value(), null, name);
    }

    public static EntityKey scoped(final EntityKind kind, final String scope, final String name) {
        return new EntityKey(Objects.requireNonNull(kind, "kind").value(), scope, name);
    }

    public Optional<EntityKind> knownKind() {
        return EntityKind.fromText(kind);
    }

    public Optional<String> scopeValue() {
        return Optional.ofNullable(scope);
    }

    @Override
    public int compareTo(final EntityKey other) {
        return ORDER.compare(this, other);
    }

    Map<String, Object> toMap() {
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("kind", kind);
        root.put("scope", scope);
        root.put("name", name);
        return root;
    }

    static EntityKey fromMap(final Map<?, ?> root, final String path) {
        final Object kind = root.get("kind");
        final Object scope = root.get("scope");
        final Object name = root.get("name");
        if (!(kind instanceof String) || !(name instanceof String)) {
            throw new IllegalArgumentException(path + " requires string kind and name");
        }
        if (scope != null && !(scope instanceof String)) {
            throw new IllegalArgumentException(path + ".scope must be a string or null");
        }
        return new EntityKey((String) kind, (String) scope, (String) name);
    }

    private static String requireText(final String value, final String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
