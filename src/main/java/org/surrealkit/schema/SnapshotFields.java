package org.surrealkit.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class SnapshotFields {
    private SnapshotFields() {}

    static int readVersion(final Map<String, Object> root) {
        final Object value = root.get("version");
        if (value == null) {
            return 1;
        }
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException("version must be an integer");
        }
        return number.intValue();
    }

    static List<Map<?, ?>> readObjectList(final Map<String, Object> root, final String key) {
        final Object value = root.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(key + " must be an array");
        }
        final List<Map<?, ?>> items = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Map<?, ?> item)) {
                throw new IllegalArgumentException(key + "[" + i + "] must be an object");
            }
            items.add(item);
        }
        return items;
    }
}
