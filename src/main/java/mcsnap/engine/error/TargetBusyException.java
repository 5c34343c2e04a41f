package mcsnap.engine.error;

/**
 * Raised when an operation that rewrites live files is requested while the
 * target server is running and the caller did not force it.
 */
public class TargetBusyException extends EngineException {

    private final String target;

    public TargetBusyException(String target) {
        super("Server '" + target + "' is currently running. Stop the server first or use force=true to override.");
        this.target = target;
    }

    public String target() {
        return target;
    }
}
