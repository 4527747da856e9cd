package kvstore;

/**
 * Base unchecked exception for storage failures.
 *
 * <p>Backends raise this (or a subclass) when a write cannot be completed or the
 * underlying medium reports an error. Driver exceptions are attached as the cause.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
