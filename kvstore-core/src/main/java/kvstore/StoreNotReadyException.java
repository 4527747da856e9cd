package kvstore;

/**
 * Thrown when a store operation is attempted before {@link KeyValueStore#connect()}
 * has completed, or after the store has been closed.
 */
public class StoreNotReadyException extends StoreException {

  public StoreNotReadyException(String message) {
    super(message);
  }
}
