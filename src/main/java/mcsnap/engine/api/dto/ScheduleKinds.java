package mcsnap.engine.api.dto;

import mcsnap.engine.error.ValidationException;
import mcsnap.engine.model.ActionKind;

import java.util.Locale;

/**
 * Wire names of action kinds: {@code config-snapshot} and {@code world-backup}.
 */
final class ScheduleKinds {

    private ScheduleKinds() {
    }

    static String wire(ActionKind kind) {
        return kind.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    static ActionKind parse(String value) {
        if (value == null || value.isBlank()) {
            return ActionKind.CONFIG_SNAPSHOT;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ActionKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown kind: \"" + value + "\" (expected config-snapshot or world-backup)");
        }
    }
}
