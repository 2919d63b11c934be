package org.surrealkit.sync;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.surrealkit.client.DatabaseClient;
import org.surrealkit.json.JsonValues;

/**
 * Append-only, content-addressed record of applied migration files in {@code _migration}.
 *
 * <p>Rows are keyed by the file hash; a modified file gets a new row and the old one stays.
 */
public final class MigrationLedger {
    static final String SELECT_BY_ID = "SELECT * FROM type::thing('_migration', $id);";
    static final String INSERT = "CREATE type::thing('_migration', $id) "
            + "CONTENT { file: $file, applied_at: <datetime> $applied_at };";
    static final String SELECT_ALL =
            "SELECT record::id(id) AS id, file, applied_at FROM _migration ORDER BY applied_at;";

    private final DatabaseClient client;
    private final Clock clock;

    public MigrationLedger(final DatabaseClient client, final Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean isApplied(final String hash) {
        return !client.execute(SELECT_BY_ID, Map.of("id", hash)).rows(0).isEmpty();
    }

    public void record(final String hash, final String file) {
        final Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("id", Objects.requireNonNull(hash, "hash"));
        bindings.put("file", Objects.requireNonNull(file, "file"));
        bindings.put("applied_at", Instant.now(clock).toString());
        client.executeChecked(INSERT, bindings);
    }

    public List<MigrationRecord> list() {
        final List<MigrationRecord> records = new ArrayList<>();
        for (final Object row : client.execute(SELECT_ALL).rows(0)) {
            if (row instanceof Map<?, ?> map) {
                records.add(new MigrationRecord(
                        text(map.get("id")),
                        text(map.get("file")),
                        text(map.get("applied_at"))));
            }
        }
        return List.copyOf(records);
    }

    private static String text(final Object value) {
        return value == null ? "" : JsonValues.toText(value);
    }
}
