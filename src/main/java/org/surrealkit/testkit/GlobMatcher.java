package org.surrealkit.testkit;

import java.util.Objects;

/**
 * Wildcard matching where {@code *} matches any run of characters (including none) and
 * {@code ?} exactly one. The whole text must match.
 */
public final class GlobMatcher {
    private GlobMatcher() {}

    public static boolean matches(final String pattern, final String text) {
        final String p = Objects.requireNonNull(pattern, "pattern");
        final String t = Objects.requireNonNull(text, "text");
        final boolean[][] table = new boolean[p.length() + 1][t.length() + 1];
        table[0][0] = true;
        for (int i = 1; i <= p.length(); i++) {
            if (p.charAt(i - 1) == '*') {
                table[i][0] = table[i - 1][0];
            }
        }
        for (int i = 1; i <= p.length(); i++) {
            final char symbol = p.charAt(i - 1);
            for (int j = 1; j <= t.length(); j++) {
                if (symbol == '*') {
                    table[i][j] = table[i - 1][j] || table[i][j - 1];
                } else if (symbol == '?' || symbol == t.charAt(j - 1)) {
                    table[i][j] = table[i - 1][j - 1];
                }
            }
        }
        return table[p.length()][t.length()];
    }
}
