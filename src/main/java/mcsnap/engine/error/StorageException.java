package mcsnap.engine.error;

/**
 * I/O or database failure while reading or writing schedules, artifacts or
 * artifact contents.
 */
public class StorageException extends EngineException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
