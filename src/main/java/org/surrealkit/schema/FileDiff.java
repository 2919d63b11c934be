package org.surrealkit.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record FileDiff(List<String> added, List<String> modified, List<String> removed) {
    public FileDiff {
        added = List.copyOf(added);
        modified = List.copyOf(modified);
        removed = List.copyOf(removed);
    }

    public static FileDiff empty() {
        return new FileDiff(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return added.isEmpty() && modified.isEmpty() && removed.isEmpty();
    }

    public Map<String, Object> toMap() {
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("added", added);
        root.put("modified", modified);
        root.put("removed", removed);
        return root;
    }
}
