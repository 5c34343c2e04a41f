package mcsnap.engine.model;

import java.util.List;

/**
 * Per-category change counts of a diff.
 */
public record DiffSummary(int added, int modified, int deleted) {

    public static DiffSummary of(List<FileChange> changes) {
        int added = 0;
        int modified = 0;
        int deleted = 0;
        for (FileChange change : changes) {
            switch (change.status()) {
                case ADDED -> added++;
                case MODIFIED -> modified++;
                case DELETED -> deleted++;
            }
        }
        return new DiffSummary(added, modified, deleted);
    }

    public int total() {
        return added + modified + deleted;
    }
}
