package mcsnap.engine.model;

/**
 * What a schedule produces when it fires.
 */
public enum ActionKind {
    /** File-set artifact: configuration files collected, hashed and copied */
    CONFIG_SNAPSHOT,
    /** Versioned-push artifact: world data pushed to the backup repository */
    WORLD_BACKUP;

    public boolean isFileSet() {
        return this == CONFIG_SNAPSHOT;
    }
}
