package kvstore.timeout;

/**
 * Thrown when a timeout id is registered twice.
 */
public class DuplicateTimeoutException extends IllegalStateException {

    public DuplicateTimeoutException(String id) {
        super("Timeout already registered: " + id);
    }
}
