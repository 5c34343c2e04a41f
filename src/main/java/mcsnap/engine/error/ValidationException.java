package mcsnap.engine.error;

/**
 * Client-fixable input error: malformed cron expression, retention bound out of
 * range, empty required field. Always raised before anything is persisted.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
