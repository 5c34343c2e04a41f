package mcsnap.engine.service;

/**
 * Options for restoring an artifact.
 *
 * @param createSafetyArtifactFirst capture the current state before overwriting it
 * @param force                     restore even while the target is running
 */
public record RestoreOptions(boolean createSafetyArtifactFirst, boolean force) {

    public static RestoreOptions defaults() {
        return new RestoreOptions(true, false);
    }
}
