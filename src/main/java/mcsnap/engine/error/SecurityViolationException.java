package mcsnap.engine.error;

/**
 * A resolved path escapes the sandboxed root of its target.
 */
public class SecurityViolationException extends EngineException {

    public SecurityViolationException(String message) {
        super(message);
    }
}
