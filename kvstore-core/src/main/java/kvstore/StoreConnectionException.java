package kvstore;

/**
 * Thrown by {@link KeyValueStore#connect()} when the storage medium is unreachable
 * or its tables cannot be created.
 */
public class StoreConnectionException extends StoreException {

  public StoreConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
