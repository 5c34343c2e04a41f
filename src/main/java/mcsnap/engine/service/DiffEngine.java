package mcsnap.engine.service;

import mcsnap.engine.error.ValidationException;
import mcsnap.engine.execution.ActionExecutor;
import mcsnap.engine.execution.GitVersionDiffer;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.model.ArtifactEntry;
import mcsnap.engine.model.DiffResult;
import mcsnap.engine.model.FileChange;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Compares two artifacts of the same kind. File-set artifacts are compared by
 * entry hash; versioned-push artifacts are compared in the backup repository.
 */
public class DiffEngine {

    private final ActionExecutor executor;
    private final GitVersionDiffer gitDiffer;

    public DiffEngine(ActionExecutor executor, GitVersionDiffer gitDiffer) {
        this.executor = executor;
        this.gitDiffer = gitDiffer;
    }

    public DiffResult compare(Artifact base, Artifact compare) {
        if (base.kind() != compare.kind()) {
            throw new ValidationException("Cannot diff artifacts of different kinds: "
                    + base.kind() + " vs " + compare.kind());
        }
        if (base.kind().isFileSet()) {
            return diff(base, executor.contents(base), compare, executor.contents(compare));
        }
        return DiffResult.of(base.id(), compare.id(), gitDiffer.diff(base.versionRef(), compare.versionRef()));
    }

    /**
     * Diff two file-set artifacts given their stored contents. Paths present in
     * both with equal hashes are omitted; the result is sorted by path.
     */
    public static DiffResult diff(Artifact base, Map<String, String> baseContents,
            Artifact compare, Map<String, String> compareContents) {
        Map<String, ArtifactEntry> baseEntries = byPath(base.entries());
        Map<String, ArtifactEntry> compareEntries = byPath(compare.entries());

        SortedSet<String> paths = new TreeSet<>(baseEntries.keySet());
        paths.addAll(compareEntries.keySet());

        List<FileChange> changes = new ArrayList<>();
        for (String path : paths) {
            ArtifactEntry before = baseEntries.get(path);
            ArtifactEntry after = compareEntries.get(path);
            if (before == null) {
                changes.add(FileChange.added(path, after.hash(), compareContents.get(path)));
            } else if (after == null) {
                changes.add(FileChange.deleted(path, before.hash(), baseContents.get(path)));
            } else if (!before.hash().equals(after.hash())) {
                changes.add(FileChange.modified(path, before.hash(), after.hash(),
                        baseContents.get(path), compareContents.get(path)));
            }
        }
        return DiffResult.of(base.id(), compare.id(), changes);
    }

    private static Map<String, ArtifactEntry> byPath(List<ArtifactEntry> entries) {
        Map<String, ArtifactEntry> map = new HashMap<>();
        for (ArtifactEntry entry : entries) {
            map.put(entry.path(), entry);
        }
        return map;
    }
}
