package mcsnap.engine.error;

/**
 * The data an action works on is missing (for example the server directory).
 */
public class PreconditionFailedException extends ActionFailedException {

    public PreconditionFailedException(String message) {
        super(message);
    }
}
