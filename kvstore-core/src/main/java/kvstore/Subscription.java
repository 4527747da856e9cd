package kvstore;

/**
 * Handle returned by {@link KeyValueStore#subscribe(StoreListener)}; closing it
 * removes the listener. Closing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

  @Override
  void close();
}
