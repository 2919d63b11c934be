package org.surrealkit.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shallow SurrealQL scanner: drops comment lines, splits on top-level semicolons and
 * tokenizes statements on whitespace.
 *
 * <p>This is not a parser. Semicolons inside single, double or backtick quotes do not split;
 * a backslash keeps the following quote character from opening or closing a quoted region.
 * Tokenizing has no quote awareness.
 */
public final class StatementSplitter {
    private StatementSplitter() {}

    /**
     * Removes whole lines whose trimmed start is {@code --} or {@code //}; inline comments stay.
     */
    public static String stripCommentLines(final String sql) {
        Objects.requireNonNull(sql, "sql");
        final StringBuilder sb = new StringBuilder(sql.length());
        for (final String line : sql.split("\n", -1)) {
            final String trimmed = line.stripLeading();
            if (trimmed.startsWith("--") || trimmed.startsWith("//")) {
                continue;
            }
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    /**
     * Comment-stripped, trimmed, non-empty statements without their terminating semicolon.
     */
    public static List<String> split(final String sql) {
        final String source = stripCommentLines(sql);
        final List<String> statements = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        Quote quote = Quote.NONE;
        boolean escapePending = false;

        for (int i = 0; i < source.length(); i++) {
            final char c = source.charAt(i);
            if (quote == Quote.NONE && c == ';') {
                emit(statements, current);
                escapePending = false;
                continue;
            }
            if (!escapePending) {
                if (quote == Quote.NONE) {
                    quote = Quote.of(c);
                } else if (quote.symbol == c) {
                    quote = Quote.NONE;
                }
            }
            escapePending = c == '\\' && !escapePending;
            current.append(c);
        }
        emit(statements, current);
        return List.copyOf(statements);
    }

    public static List<String> tokenize(final String statement) {
        final String trimmed = Objects.requireNonNull(statement, "statement").trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return List.of(trimmed.split("\\s+"));
    }

    private static void emit(final List<String> statements, final StringBuilder current) {
        final String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }

    private enum Quote {
        NONE('\0'),
        SINGLE('\''),
        DOUBLE('"'),
        BACKTICK('`');

        private final char symbol;

        Quote(final char symbol) {
            this.symbol = symbol;
        }

        static Quote of(final char c) {
            return switch (c) {
                case '\'' -> SINGLE;
                case '"' -> DOUBLE;
                case '`' -> BACKTICK;
                default -> NONE;
            };
        }
    }
}
