package org.surrealkit.schema;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds a structural inventory of schema entities from {@code DEFINE} statements.
 */
public final class CatalogExtractor {
    private static final Set<String> MODIFIERS = Set.of("OVERWRITE", "IF", "NOT", "EXISTS");
    private static final String TRAILING_PUNCTUATION = ",;(){}";

    private CatalogExtractor() {}

    public static CatalogSnapshot buildCatalog(final List<SchemaFile> files) {
        Objects.requireNonNull(files, "files");
        final Set<EntityKey> entities = new TreeSet<>();
        for (final SchemaFile file : files) {
            entities.addAll(extractAll(file.sql()));
        }
        return CatalogSnapshot.of(entities);
    }

    public static Set<EntityKey> extractAll(final String sql) {
        final Set<EntityKey> entities = new TreeSet<>();
        for (final String statement : StatementSplitter.split(sql)) {
            extract(statement).ifPresent(entities::add);
        }
        return entities;
    }

    /**
     * Entity defined by a single statement, or empty when the statement is not a recognised
     * {@code DEFINE}.
     */
    public static Optional<EntityKey> extract(final String statement) {
        final List<String> tokens = StatementSplitter.tokenize(statement);
        if (tokens.size() < 3 || !"DEFINE".equalsIgnoreCase(tokens.get(0))) {
            return Optional.empty();
        }
        final Optional<EntityKind> kind = EntityKind.fromText(tokens.get(1));
        if (kind.isEmpty()) {
            return Optional.empty();
        }

        int nameIndex = 2;
        while (nameIndex < tokens.size() && MODIFIERS.contains(upper(tokens.get(nameIndex)))) {
            nameIndex++;
        }
        if (nameIndex >= tokens.size()) {
            return Optional.empty();
        }
        final String name = cleanName(tokens.get(nameIndex));
        if (name.isEmpty()) {
            return Optional.empty();
        }

        final Optional<String> scope = scopeAfterOn(tokens, nameIndex + 1);
        return switch (kind.get().scopeRule()) {
            case NONE -> Optional.of(EntityKey.of(kind.get(), name));
            case REQUIRED -> scope.map(value -> EntityKey.scoped(kind.get(), value, name));
            case OPTIONAL -> Optional.of(EntityKey.scoped(kind.get(), scope.orElse(null), name));
        };
    }

    static String cleanName(final String token) {
        String name = token;
        final int paren = name.indexOf('(');
        if (paren >= 0) {
            name = name.substring(0, paren);
        }
        int end = name.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(name.charAt(end - 1)) >= 0) {
            end--;
        }
        return name.substring(0, end);
    }

    private static Optional<String> scopeAfterOn(final List<String> tokens, final int from) {
        for (int i = from; i < tokens.size(); i++) {
            if (!"ON".equals(upper(tokens.get(i)))) {
                continue;
            }
            int scopeIndex = i + 1;
            if (scopeIndex < tokens.size() && "TABLE".equals(upper(tokens.get(scopeIndex)))) {
                scopeIndex++;
            }
            if (scopeIndex >= tokens.size()) {
                return Optional.empty();
            }
            final String scope = cleanName(tokens.get(scopeIndex));
            return scope.isEmpty() ? Optional.empty() : Optional.of(scope);
        }
        return Optional.empty();
    }

    private static String upper(final String token) {
        return token.toUpperCase(Locale.ROOT);
    }
}
