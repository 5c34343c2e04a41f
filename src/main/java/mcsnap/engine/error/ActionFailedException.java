package mcsnap.engine.error;

/**
 * The external action (file collection, backup push, restore command) failed.
 * Scheduled firings convert this into a recorded failure; direct calls see it.
 */
public class ActionFailedException extends EngineException {

    public ActionFailedException(String message) {
        super(message);
    }

    public ActionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
