package mcsnap.engine.error;

/**
 * Base type for failures surfaced by the snapshot engine to its callers.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
