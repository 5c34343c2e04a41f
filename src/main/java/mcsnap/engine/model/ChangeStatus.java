package mcsnap.engine.model;

import java.util.Locale;

/**
 * Category of a per-path change between two artifacts.
 */
public enum ChangeStatus {
    ADDED,
    MODIFIED,
    DELETED;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
