package kvstore;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Notification describing a change applied to one table.
 *
 * <p>Events are emitted after the write has completed. A {@code set} that leaves the
 * stored value unchanged (deep-equal) emits nothing.
 *
 * @see StoreListener
 */
public sealed interface ChangeEvent
    permits ChangeEvent.Create, ChangeEvent.Update, ChangeEvent.Delete, ChangeEvent.ClearAll {

  /** The table the change was applied to. */
  String table();

  /**
   * A value was written under a key that had no prior record.
   */
  record Create(String table, String key, JsonNode data) implements ChangeEvent {
    public Create {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(data, "data");
    }
  }

  /**
   * A value replaced a different, previously stored value.
   */
  record Update(String table, String key, JsonNode newData, JsonNode oldData) implements ChangeEvent {
    public Update {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(newData, "newData");
      Objects.requireNonNull(oldData, "oldData");
    }
  }

  /**
   * One or more keys were deleted.
   *
   * @param keys the keys requested for deletion, in request order
   * @param data values of the requested keys that existed just before removal;
   *             keys that were already absent have no entry
   */
  record Delete(String table, List<String> keys, Map<String, JsonNode> data) implements ChangeEvent {
    public Delete {
      Objects.requireNonNull(table, "table");
      keys = List.copyOf(keys);
      data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
  }

  /**
   * A table was cleared.
   *
   * @param records snapshot of every record removed
   */
  record ClearAll(String table, Map<String, JsonNode> records) implements ChangeEvent {
    public ClearAll {
      Objects.requireNonNull(table, "table");
      records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }
  }
}
