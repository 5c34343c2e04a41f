package mcsnap.engine.model;

import java.util.Locale;

/**
 * Outcome of the last run of a schedule.
 */
public enum RunStatus {
    SUCCESS,
    FAILURE;

    /** Lowercase form used in persisted rows and responses */
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
