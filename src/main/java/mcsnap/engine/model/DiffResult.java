package mcsnap.engine.model;

import java.util.List;

/**
 * Structural comparison of two artifacts. Derived on demand, never persisted.
 */
public record DiffResult(
        String baseId,
        String compareId,
        List<FileChange> changes,
        DiffSummary summary) {

    public DiffResult {
        changes = List.copyOf(changes);
    }

    public static DiffResult of(String baseId, String compareId, List<FileChange> changes) {
        return new DiffResult(baseId, compareId, changes, DiffSummary.of(changes));
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }
}
