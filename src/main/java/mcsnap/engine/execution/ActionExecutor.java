package mcsnap.engine.execution;

import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.model.TargetName;

import java.util.Map;

/**
 * Dispatches an action kind to its implementation. This is the single place
 * the engine branches on {@link ActionKind}.
 */
public class ActionExecutor {

    private final ConfigSnapshotAction configSnapshots;
    private final WorldBackupAction worldBackups;

    public ActionExecutor(ConfigSnapshotAction configSnapshots, WorldBackupAction worldBackups) {
        this.configSnapshots = configSnapshots;
        this.worldBackups = worldBackups;
    }

    /**
     * Verify the directories the action needs exist.
     *
     * @throws mcsnap.engine.error.PreconditionFailedException if they do not
     */
    public void checkPreconditions(ActionKind kind, TargetName target) {
        switch (kind) {
            case CONFIG_SNAPSHOT -> configSnapshots.checkPreconditions(target);
            case WORLD_BACKUP -> worldBackups.checkPreconditions();
        }
    }

    /**
     * Run the action and persist the artifact it produced.
     *
     * @param description artifact description, also the commit message for world backups
     * @param scheduleId  owning schedule, or null for a manual run
     * @throws mcsnap.engine.error.ActionFailedException if the action failed
     */
    public ActionResult run(ActionKind kind, TargetName target, String description, String scheduleId) {
        return switch (kind) {
            case CONFIG_SNAPSHOT -> configSnapshots.capture(target, description, scheduleId);
            case WORLD_BACKUP -> worldBackups.push(target, description, scheduleId);
        };
    }

    /**
     * Put the target back into the state the artifact captured.
     *
     * @return number of files written, 0 for a world backup
     */
    public int restore(Artifact artifact) {
        return switch (artifact.kind()) {
            case CONFIG_SNAPSHOT -> configSnapshots.restore(artifact);
            case WORLD_BACKUP -> {
                worldBackups.restore(artifact);
                yield 0;
            }
        };
    }

    /**
     * Remove stored contents of an artifact. World backups live in git history,
     * which is left untouched.
     */
    public void discard(Artifact artifact) {
        if (artifact.kind().isFileSet()) {
            configSnapshots.discard(artifact);
        }
    }

    /**
     * Stored file contents of a file-set artifact, keyed by path.
     */
    public Map<String, String> contents(Artifact artifact) {
        return artifact.kind().isFileSet() ? configSnapshots.contents(artifact) : Map.of();
    }
}
