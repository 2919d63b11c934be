package org.surrealkit.sync;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.surrealkit.schema.EntityKey;
import org.surrealkit.schema.FileDiff;

/**
 * Outcome of one reconciliation pass.
 */
public record SyncPassResult(
        FileDiff fileDiff,
        List<String> changedPaths,
        int applyErrors,
        List<EntityKey> staleEntities,
        List<String> pruneStatements,
        int prunedEntities) {

    public SyncPassResult {
        changedPaths = List.copyOf(changedPaths);
        staleEntities = List.copyOf(staleEntities);
        pruneStatements = List.copyOf(pruneStatements);
    }

    public int changedFiles() {
        return changedPaths.size();
    }

    public boolean hasChanges() {
        return !changedPaths.isEmpty() || !staleEntities.isEmpty();
    }

    public Map<String, Object> toLogFields() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("changedFiles", changedPaths.size());
        fields.put("applyErrors", applyErrors);
        fields.put("staleEntities", staleEntities.size());
        fields.put("prunedEntities", prunedEntities);
        fields.put("fileDiff", fileDiff.toMap());
        return fields;
    }
}
