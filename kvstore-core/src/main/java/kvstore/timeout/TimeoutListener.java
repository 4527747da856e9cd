package kvstore.timeout;

/**
 * Observer of timeout scheduling and expiry.
 *
 * <p>Callbacks run synchronously; exceptions are logged and ignored.
 */
public interface TimeoutListener {

    /** Called after a timeout has been persisted and armed. */
    default void onScheduled(TimeoutRecord record) {
    }

    /** Called when a timeout expires, before its action runs. */
    default void onFired(TimeoutRecord record) {
    }
}
