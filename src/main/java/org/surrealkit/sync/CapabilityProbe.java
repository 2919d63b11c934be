package org.surrealkit.sync;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.surrealkit.client.DatabaseClient;
import org.surrealkit.client.QueryExecutionException;

/**
 * Detects optional server features by issuing harmless statements.
 */
public final class CapabilityProbe {
    static final String REMOVE_API_PROBE = "REMOVE API __surrealkit_capability_probe__;";
    private static final List<String> UNSUPPORTED_MARKERS =
            List.of("unexpected", "parse", "not implemented", "invalid statement");

    private CapabilityProbe() {}

    /**
     * Whether the server understands {@code REMOVE API}. Errors such as "api does not exist"
     * still imply support; only syntax-level errors mean unsupported.
     */
    public static boolean supportsRemoveApi(final DatabaseClient client) {
        Objects.requireNonNull(client, "client");
        try {
            client.executeChecked(REMOVE_API_PROBE);
            return true;
        } catch (final QueryExecutionException exception) {
            final String message = String.valueOf(exception.getMessage()).toLowerCase(Locale.ROOT);
            for (final String marker : UNSUPPORTED_MARKERS) {
                if (message.contains(marker)) {
                    return false;
                }
            }
            return true;
        }
    }
}
