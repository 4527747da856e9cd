package kvstore.support;

import com.fasterxml.jackson.databind.JsonNode;
import kvstore.ChangeEvent;
import kvstore.KeyValueStore;
import kvstore.StoreListener;
import kvstore.Subscription;
import kvstore.util.JsonValues;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides which {@link ChangeEvent} a write warrants and delivers it to listeners.
 *
 * <p>Backends read the previous value, perform the write, then call one of the
 * {@code record*} methods. Listeners are invoked in subscription order; a failing
 * listener is logged and skipped.
 */
public final class ChangeNotifier {
  private static final Logger logger = Logger.getLogger(ChangeNotifier.class.getName());

  private final CopyOnWriteArrayList<StoreListener> listeners = new CopyOnWriteArrayList<>();

  public Subscription subscribe(StoreListener listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  public int listenerCount() {
    return listeners.size();
  }

  public void fireReady(KeyValueStore store) {
    for (StoreListener listener : listeners) {
      try {
        listener.onReady(store);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Store listener failed on ready", e);
      }
    }
  }

  /**
   * Emits {@code Create} when there was no previous value, {@code Update} when the value
   * changed, and nothing otherwise.
   *
   * @return the emitted event, or empty when the write was suppressed
   */
  public Optional<ChangeEvent> recordWrite(String table, String key, Optional<JsonNode> previous,
      JsonNode value) {
    ChangeEvent event;
    if (previous.isEmpty()) {
      event = new ChangeEvent.Create(table, key, value);
    } else if (!JsonValues.deepEquals(previous.get(), value)) {
      event = new ChangeEvent.Update(table, key, value, previous.get());
    } else {
      return Optional.empty();
    }
    publish(event);
    return Optional.of(event);
  }

  public ChangeEvent recordDelete(String table, List<String> keys, Map<String, JsonNode> removed) {
    ChangeEvent event = new ChangeEvent.Delete(table, keys, removed);
    publish(event);
    return event;
  }

  public ChangeEvent recordClear(String table, Map<String, JsonNode> snapshot) {
    ChangeEvent event = new ChangeEvent.ClearAll(table, snapshot);
    publish(event);
    return event;
  }

  private void publish(ChangeEvent event) {
    for (StoreListener listener : listeners) {
      try {
        listener.onChange(event);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Store listener failed on " + event.getClass().getSimpleName()
            + " for table " + event.table(), e);
      }
    }
  }
}
