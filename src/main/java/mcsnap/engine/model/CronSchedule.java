package mcsnap.engine.model;

import mcsnap.engine.error.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated five-field cron expression (minute hour day-of-month month day-of-week).
 * <p>
 * Each field accepts {@code *}, a number, a range {@code n-m}, a list
 * {@code a,b,c} or a step {@code *}{@code /s} / {@code n-m/s}.
 */
public final class CronSchedule {

    private static final Map<String, String> PRESETS;
    private static final Map<String, String> PRESET_DESCRIPTIONS;

    static {
        Map<String, String> presets = new LinkedHashMap<>();
        presets.put("hourly", "0 * * * *");
        presets.put("daily", "0 3 * * *");
        presets.put("every-6h", "0 */6 * * *");
        presets.put("every-12h", "0 */12 * * *");
        presets.put("weekly", "0 3 * * 0");
        PRESETS = Collections.unmodifiableMap(presets);

        Map<String, String> descriptions = new LinkedHashMap<>();
        descriptions.put("0 * * * *", "Every hour");
        descriptions.put("0 3 * * *", "Daily at 3:00 AM");
        descriptions.put("0 */6 * * *", "Every 6 hours");
        descriptions.put("0 */12 * * *", "Every 12 hours");
        descriptions.put("0 3 * * 0", "Weekly on Sunday at 3:00 AM");
        PRESET_DESCRIPTIONS = Collections.unmodifiableMap(descriptions);
    }

    private static final String[] FIELD_NAMES = { "minute", "hour", "day of month", "month", "day of week" };
    private static final int[] FIELD_MIN = { 0, 0, 1, 1, 0 };
    private static final int[] FIELD_MAX = { 59, 23, 31, 12, 7 };

    private final String expression;

    private CronSchedule(String expression) {
        this.expression = expression;
    }

    /**
     * Parse and validate a raw cron string.
     *
     * @throws ValidationException if the expression is not a valid five-field cron
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("Cron expression cannot be empty");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length != 5) {
            throw new ValidationException(
                    "Invalid cron expression: expected 5 fields (minute hour day-of-month month day-of-week), got "
                            + fields.length);
        }
        for (int i = 0; i < fields.length; i++) {
            validateField(fields[i], FIELD_NAMES[i], FIELD_MIN[i], FIELD_MAX[i]);
        }
        return new CronSchedule(String.join(" ", fields));
    }

    /**
     * Resolve a named preset such as {@code daily} or {@code every-6h}.
     */
    public static CronSchedule fromPreset(String preset) {
        String expression = PRESETS.get(preset);
        if (expression == null) {
            throw new ValidationException("Unknown cron preset: \"" + preset + "\". Available presets: "
                    + String.join(", ", PRESETS.keySet()));
        }
        return new CronSchedule(expression);
    }

    public static Map<String, String> presets() {
        return PRESETS;
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    public String expression() {
        return expression;
    }

    public String toHumanReadable() {
        String description = PRESET_DESCRIPTIONS.get(expression);
        return description != null ? description : "Cron: " + expression;
    }

    /**
     * Six-field form with a fixed seconds column, as understood by Spring's
     * {@code CronExpression}.
     */
    public String toSecondsPrecision() {
        return "0 " + expression;
    }

    private static void validateField(String field, String name, int min, int max) {
        if (field.equals("*")) {
            return;
        }

        if (field.contains(",")) {
            for (String part : field.split(",", -1)) {
                if (part.isEmpty()) {
                    throw new ValidationException("Invalid list in " + name + " field: \"" + field + "\"");
                }
                validateField(part, name, min, max);
            }
            return;
        }

        if (field.contains("/")) {
            String[] parts = field.split("/", -1);
            if (parts.length != 2) {
                throw new ValidationException("Invalid step value in " + name + " field: \"" + field + "\"");
            }
            Integer step = parseNumber(parts[1]);
            if (step == null || step < 1) {
                throw new ValidationException("Invalid step value in " + name + " field: \"" + field + "\"");
            }
            if (!parts[0].equals("*")) {
                validateField(parts[0], name, min, max);
            }
            return;
        }

        if (field.contains("-")) {
            String[] parts = field.split("-", -1);
            Integer start = parts.length == 2 ? parseNumber(parts[0]) : null;
            Integer end = parts.length == 2 ? parseNumber(parts[1]) : null;
            if (start == null || end == null) {
                throw new ValidationException("Invalid range in " + name + " field: \"" + field + "\"");
            }
            if (start < min || start > max || end < min || end > max) {
                throw new ValidationException("Value out of range in " + name + " field: \"" + field
                        + "\" (allowed: " + min + "-" + max + ")");
            }
            if (start > end) {
                throw new ValidationException("Invalid range in " + name + " field: start (" + start
                        + ") > end (" + end + ")");
            }
            return;
        }

        Integer value = parseNumber(field);
        if (value == null) {
            throw new ValidationException("Invalid value in " + name + " field: \"" + field + "\"");
        }
        if (value < min || value > max) {
            throw new ValidationException("Value out of range in " + name + " field: " + value
                    + " (allowed: " + min + "-" + max + ")");
        }
    }

    private static Integer parseNumber(String s) {
        if (s.isEmpty() || s.length() > 4) {
            return null;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return null;
            }
        }
        return Integer.parseInt(s);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CronSchedule other))
            return false;
        return expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
