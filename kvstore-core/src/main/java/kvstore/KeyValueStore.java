package kvstore;

import com.fasterxml.jackson.databind.JsonNode;
import kvstore.support.StorageDocuments;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Table-partitioned key-value store with change notification.
 *
 * <p>Every backend (file, JDBC, MongoDB, Firestore) offers the same contract:
 * <ul>
 *   <li>Tables are fixed when the store is built. The reserved table
 *       {@value TableNames#TIMEOUT_TABLE} is always present.</li>
 *   <li>All data operations require a prior {@link #connect()}; otherwise they throw
 *       {@link StoreNotReadyException}. Undeclared tables raise {@link UnknownTableException}.</li>
 *   <li>{@link #set} emits {@link ChangeEvent.Create} for a new key, {@link ChangeEvent.Update}
 *       when the stored value actually changes, and nothing when the new value is deep-equal
 *       to the old one.</li>
 *   <li>{@link #delete} and {@link #clear} emit exactly one event per call.</li>
 *   <li>Read failures of the medium are logged and treated as an empty table or absent key;
 *       write failures are logged and raised as {@link StoreException}.</li>
 * </ul>
 *
 * <p>Operations are synchronous: when a call returns, its effect is durable and its event
 * has been delivered.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (KeyValueStore store = FileKeyValueStore.builder()
 *     .path(Path.of("./database"))
 *     .tables(List.of("main", "users"))
 *     .build()) {
 *   store.subscribe((ChangeListener) event -> System.out.println(event));
 *   store.connect();
 *   store.set("main", "greeting", TextNode.valueOf("hello"));
 * }
 * }</pre>
 */
public interface KeyValueStore extends AutoCloseable {

  /**
   * Acquires resources, creates missing tables and marks the store ready. The first
   * successful call notifies {@link StoreListener#onReady}; later calls are no-ops.
   *
   * @throws StoreConnectionException if the medium is unreachable
   */
  void connect();

  boolean isReady();

  /** Declared tables in declaration order, ending with {@value TableNames#TIMEOUT_TABLE}. */
  List<String> tables();

  default boolean hasTable(String table) {
    return tables().contains(table);
  }

  Optional<JsonNode> get(String table, String key);

  /**
   * Stores a value, replacing any previous one.
   *
   * @return this store, for chaining
   */
  KeyValueStore set(String table, String key, JsonNode value);

  boolean has(String table, String key);

  /**
   * Returns a point-in-time, unmodifiable snapshot of a table.
   */
  Map<String, JsonNode> all(String table);

  default Optional<Entry> findOne(String table, Predicate<Entry> filter) {
    int index = 0;
    for (Map.Entry<String, JsonNode> record : all(table).entrySet()) {
      Entry entry = new Entry(record.getKey(), record.getValue(), index++);
      if (filter.test(entry)) {
        return Optional.of(entry);
      }
    }
    return Optional.empty();
  }

  default List<Entry> findMany(String table, Predicate<Entry> filter) {
    List<Entry> matches = new ArrayList<>();
    int index = 0;
    for (Map.Entry<String, JsonNode> record : all(table).entrySet()) {
      Entry entry = new Entry(record.getKey(), record.getValue(), index++);
      if (filter.test(entry)) {
        matches.add(entry);
      }
    }
    return matches;
  }

  default void delete(String table, String key) {
    delete(table, List.of(key));
  }

  /**
   * Deletes the given keys and emits a single {@link ChangeEvent.Delete}, even when none
   * of them existed.
   */
  void delete(String table, Collection<String> keys);

  /**
   * Deletes every record matching the filter. Matches are computed on a snapshot and
   * removed one key at a time, so listeners see one event per key.
   *
   * @return the number of keys deleted
   */
  default int deleteMany(String table, Predicate<Entry> filter) {
    List<Entry> matches = findMany(table, filter);
    for (Entry entry : matches) {
      delete(table, entry.key());
    }
    return matches.size();
  }

  /**
   * Removes every record of a table and emits one {@link ChangeEvent.ClearAll}.
   */
  void clear(String table);

  /**
   * Measures how long it takes to read every declared table.
   */
  default Duration ping() {
    long start = System.nanoTime();
    for (String table : tables()) {
      all(table);
    }
    return Duration.ofNanos(System.nanoTime() - start);
  }

  /**
   * Imports a storage document ({@code {"k": {"key": "k", "value": ...}}}) into a table.
   * An unreadable file is logged and imports nothing.
   *
   * @return the number of records written
   * @throws IllegalArgumentException if {@code file} is {@code null}
   */
  default int convertFileToTable(String table, Path file) {
    if (file == null) {
      throw new IllegalArgumentException("file path is required");
    }
    Map<String, JsonNode> records = StorageDocuments.readQuietly(file);
    for (Map.Entry<String, JsonNode> record : records.entrySet()) {
      set(table, record.getKey(), record.getValue());
    }
    return records.size();
  }

  /**
   * Exports a table as a storage document.
   *
   * @return the number of records written
   * @throws IllegalArgumentException if {@code file} is {@code null}
   * @throws StoreException if the file cannot be written
   */
  default int convertTableToFile(String table, Path file) {
    if (file == null) {
      throw new IllegalArgumentException("file path is required");
    }
    Map<String, JsonNode> records = all(table);
    StorageDocuments.writeOrThrow(file, records);
    return records.size();
  }

  /**
   * Writes every default whose key is absent. Existing values are never overwritten.
   *
   * @param defaults key to default value
   * @param tables   target tables; the first declared table when none are given
   * @return the number of values written
   */
  default int seed(Map<String, JsonNode> defaults, String... tables) {
    List<String> targets = tables == null || tables.length == 0
        ? List.of(tables().get(0))
        : List.of(tables);
    int written = 0;
    for (String table : targets) {
      for (Map.Entry<String, JsonNode> entry : defaults.entrySet()) {
        if (!has(table, entry.getKey())) {
          set(table, entry.getKey(), entry.getValue());
          written++;
        }
      }
    }
    return written;
  }

  Subscription subscribe(StoreListener listener);

  default Subscription subscribe(ChangeListener listener) {
    return subscribe((StoreListener) listener);
  }

  /**
   * Releases backend resources. Further data operations throw {@link StoreNotReadyException}.
   */
  @Override
  void close();
}
