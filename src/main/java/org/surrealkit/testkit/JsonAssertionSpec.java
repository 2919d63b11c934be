package org.surrealkit.testkit;

import java.util.Objects;

/**
 * Checks on the value found at a dot-separated path. {@code equalsPresent} distinguishes an
 * expected JSON {@code null} from no equality check.
 */
public record JsonAssertionSpec(
        String path,
        Boolean exists,
        boolean equalsPresent,
        Object equalTo,
        String contains,
        String regex) {

    public JsonAssertionSpec {
        path = Objects.requireNonNullElse(path, "");
    }

    public static JsonAssertionSpec exists(final String path, final boolean expected) {
        return new JsonAssertionSpec(path, expected, false, null, null, null);
    }

    public static JsonAssertionSpec equalTo(final String path, final Object expected) {
        return new JsonAssertionSpec(path, null, true, expected, null, null);
    }
}
