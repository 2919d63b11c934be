package org.surrealkit.testkit;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Dot-separated lookup into a JSON value tree. Numeric segments index arrays; other segments
 * read object keys; empty segments are ignored.
 */
public final class JsonPath {
    private JsonPath() {}

    /**
     * Value at {@code path}, or {@link Optional#empty()} when the path leaves the tree. A
     * present JSON {@code null} is reported as {@link Found} holding {@code null}.
     */
    public static Optional<Found> lookup(final Object root, final String path) {
        Objects.requireNonNull(path, "path");
        Object cursor = root;
        if (path.isBlank()) {
            return Optional.of(new Found(cursor));
        }
        for (final String segment : path.split("\\.", -1)) {
            if (segment.isEmpty()) {
                continue;
            }
            if (isIndex(segment)) {
                if (!(cursor instanceof List<?> list)) {
                    return Optional.empty();
                }
                final int index;
                try {
                    index = Integer.parseInt(segment);
                } catch (final NumberFormatException outOfRange) {
                    return Optional.empty();
                }
                if (index >= list.size()) {
                    return Optional.empty();
                }
                cursor = list.get(index);
                continue;
            }
            if (!(cursor instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Optional.empty();
            }
            cursor = map.get(segment);
        }
        return Optional.of(new Found(cursor));
    }

    private static boolean isIndex(final String segment) {
        for (int i = 0; i < segment.length(); i++) {
            final char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    public record Found(Object value) {}
}
