package mcsnap.engine.model;

import mcsnap.engine.error.ValidationException;

import java.util.regex.Pattern;

/**
 * Identifier of a server (or dataset) whose state is captured.
 * Target names are used as directory names, so the allowed alphabet is narrow.
 */
public final class TargetName {

    private static final Pattern VALID = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9_-]{0,63}$");

    private final String value;

    private TargetName(String value) {
        this.value = value;
    }

    public static TargetName of(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("serverName is required");
        }
        String trimmed = value.trim();
        if (!VALID.matcher(trimmed).matches()) {
            throw new ValidationException("Invalid server name: \"" + trimmed
                    + "\" (letters, digits, '-' and '_' only, max 64 chars)");
        }
        return new TargetName(trimmed);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TargetName other))
            return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
