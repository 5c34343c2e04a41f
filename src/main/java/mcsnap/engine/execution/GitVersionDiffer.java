package mcsnap.engine.execution;

import mcsnap.engine.error.ActionFailedException;
import mcsnap.engine.model.FileChange;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lists the files that changed between two commits of the backup repository.
 * Renames are reported as a delete plus an add. No content is carried.
 */
public class GitVersionDiffer {

    private final Path backupRepoDir;
    private final Duration timeout;
    private final ProcessRunner runner;

    public GitVersionDiffer(Path backupRepoDir, Duration timeout, ProcessRunner runner) {
        this.backupRepoDir = backupRepoDir;
        this.timeout = timeout;
        this.runner = runner;
    }

    public List<FileChange> diff(String baseRef, String compareRef) {
        List<String> args = List.of("-c", "core.quotepath=off", "diff", "--name-status", "--no-renames",
                WorldBackupAction.requireValidRef(baseRef), WorldBackupAction.requireValidRef(compareRef));
        ProcessResult result = runner.run(ProcessCommand.of("git", args, backupRepoDir, timeout));
        if (!result.succeeded()) {
            throw new ActionFailedException("git diff failed: " + result.diagnostic());
        }
        return parse(result.stdout());
    }

    static List<FileChange> parse(String nameStatus) {
        List<FileChange> changes = new ArrayList<>();
        for (String line : nameStatus.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            String[] parts = line.split("\t");
            if (parts.length < 2) {
                continue;
            }
            char status = parts[0].charAt(0);
            switch (status) {
                case 'A' -> changes.add(FileChange.added(parts[1], null, null));
                case 'D' -> changes.add(FileChange.deleted(parts[1], null, null));
                case 'R', 'C' -> {
                    if (parts.length >= 3) {
                        if (status == 'R') {
                            changes.add(FileChange.deleted(parts[1], null, null));
                        }
                        changes.add(FileChange.added(parts[2], null, null));
                    }
                }
                default -> changes.add(FileChange.modified(parts[1], null, null, null, null));
            }
        }
        changes.sort(Comparator.comparing(FileChange::path));
        return changes;
    }
}
