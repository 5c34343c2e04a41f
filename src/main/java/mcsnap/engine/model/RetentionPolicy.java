package mcsnap.engine.model;

import mcsnap.engine.error.ValidationException;

/**
 * Count and/or age bounds on an artifact history. Both bounds are optional;
 * with neither set everything is retained.
 */
public record RetentionPolicy(Integer maxCount, Integer maxAgeDays) {

    public static final int MIN_COUNT = 1;
    public static final int MAX_COUNT = 100;

    private static final RetentionPolicy NONE = new RetentionPolicy(null, null);

    public RetentionPolicy {
        if (maxCount != null && (maxCount < MIN_COUNT || maxCount > MAX_COUNT)) {
            throw new ValidationException("retentionCount must be between " + MIN_COUNT + " and " + MAX_COUNT
                    + ", got " + maxCount);
        }
        if (maxAgeDays != null && maxAgeDays < 1) {
            throw new ValidationException("retentionMaxAgeDays must be a positive integer (>= 1), got " + maxAgeDays);
        }
    }

    public static RetentionPolicy none() {
        return NONE;
    }

    public static RetentionPolicy ofCount(int maxCount) {
        return new RetentionPolicy(maxCount, null);
    }

    public boolean isEmpty() {
        return maxCount == null && maxAgeDays == null;
    }

    public boolean hasCountBound() {
        return maxCount != null;
    }

    public boolean hasAgeBound() {
        return maxAgeDays != null;
    }
}
