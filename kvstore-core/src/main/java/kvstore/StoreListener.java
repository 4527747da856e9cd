package kvstore;

/**
 * Observer of store lifecycle and data changes.
 *
 * <p>Both callbacks run synchronously on the thread that performed the operation.
 * Exceptions thrown by a listener are logged and do not affect the write or other
 * listeners.
 *
 * @see KeyValueStore#subscribe(StoreListener)
 */
public interface StoreListener {

  /**
   * Called once, after the first successful {@link KeyValueStore#connect()}.
   */
  default void onReady(KeyValueStore store) {
  }

  /**
   * Called after a create, update, delete or clear.
   */
  default void onChange(ChangeEvent event) {
  }
}
