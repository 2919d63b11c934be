package org.surrealkit.testkit;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Declared identity; each credential may be a literal or the name of an environment variable.
 */
public record ActorSpec(
        ActorKind kind,
        String username,
        String usernameEnv,
        String password,
        String passwordEnv,
        String namespace,
        String namespaceEnv,
        String database,
        String databaseEnv,
        String access,
        String accessEnv,
        Map<String, Object> params,
        String token,
        String tokenEnv,
        Map<String, String> headers) {

    public ActorSpec {
        Objects.requireNonNull(kind, "kind");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(headers));
    }

    public static ActorSpec ofKind(final ActorKind kind) {
        return new ActorSpec(kind, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }
}
