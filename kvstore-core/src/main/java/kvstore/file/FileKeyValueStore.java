package kvstore.file;

import com.fasterxml.jackson.databind.JsonNode;
import kvstore.KeyValueStore;
import kvstore.StoreConnectionException;
import kvstore.StoreException;
import kvstore.StoreListener;
import kvstore.Subscription;
import kvstore.support.ChangeNotifier;
import kvstore.support.StorageDocuments;
import kvstore.support.StoreGuard;
import kvstore.util.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link KeyValueStore} that keeps each table in a JSON document on the local file system.
 *
 * <p>Layout: {@code <path>/<table>/storage<extension>}, each document holding
 * {@code {"<key>": {"key": "<key>", "value": ...}}}. Missing directories and documents
 * are created as {@code {}} on {@link #connect()}.
 *
 * <p>Every write rewrites the whole document through a temp file and an atomic move.
 * Read-modify-write sequences are serialized by an instance lock, so one instance must
 * own a directory; concurrent instances on the same path are not coordinated.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class FileKeyValueStore implements KeyValueStore {
  private static final Logger logger = Logger.getLogger(FileKeyValueStore.class.getName());

  public static final Path DEFAULT_PATH = Path.of("./database/");
  public static final String DEFAULT_EXTENSION = ".json";
  static final String DOCUMENT_NAME = "storage";

  private final Path root;
  private final String extension;
  private final JsonCodec jsonCodec;
  private final StoreGuard guard;
  private final ChangeNotifier notifier = new ChangeNotifier();
  private final ReentrantLock lock = new ReentrantLock();

  private FileKeyValueStore(Builder builder) {
    this.root = builder.path != null ? builder.path : DEFAULT_PATH;
    String extension = builder.extension != null ? builder.extension : DEFAULT_EXTENSION;
    if (!extension.startsWith(".") || extension.length() < 2) {
      throw new IllegalArgumentException("extension must start with '.': " + extension);
    }
    this.extension = extension;
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.guard = new StoreGuard("FileKeyValueStore", builder.tables);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Path of the document backing {@code table}. */
  public Path documentPath(String table) {
    return root.resolve(table).resolve(DOCUMENT_NAME + extension);
  }

  @Override
  public void connect() {
    lock.lock();
    try {
      if (guard.isReady()) {
        return;
      }
      for (String table : guard.tables()) {
        Path document = documentPath(table);
        Files.createDirectories(document.getParent());
        if (!Files.exists(document)) {
          Files.writeString(document, "{}", StandardCharsets.UTF_8);
        }
      }
    } catch (IOException e) {
      throw new StoreConnectionException("Failed to prepare storage directory " + root, e);
    } finally {
      lock.unlock();
    }
    if (guard.markReady()) {
      logger.log(Level.INFO, "File store ready at {0} with tables {1}",
          new Object[]{root.toAbsolutePath(), guard.tables()});
      notifier.fireReady(this);
    }
  }

  @Override
  public boolean isReady() {
    return guard.isReady();
  }

  @Override
  public List<String> tables() {
    return guard.tables();
  }

  @Override
  public Optional<JsonNode> get(String table, String key) {
    guard.check(table);
    return Optional.ofNullable(read(table).get(key));
  }

  @Override
  public KeyValueStore set(String table, String key, JsonNode value) {
    guard.check(table);
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    Optional<JsonNode> previous;
    lock.lock();
    try {
      Map<String, JsonNode> records = read(table);
      previous = Optional.ofNullable(records.put(key, value));
      write(table, records);
    } finally {
      lock.unlock();
    }
    notifier.recordWrite(table, key, previous, value);
    return this;
  }

  @Override
  public boolean has(String table, String key) {
    guard.check(table);
    return read(table).containsKey(key);
  }

  @Override
  public Map<String, JsonNode> all(String table) {
    guard.check(table);
    return Collections.unmodifiableMap(read(table));
  }

  @Override
  public void delete(String table, Collection<String> keys) {
    guard.check(table);
    List<String> requested = List.copyOf(keys);
    Map<String, JsonNode> removed = new LinkedHashMap<>();
    lock.lock();
    try {
      Map<String, JsonNode> records = read(table);
      for (String key : requested) {
        if (records.containsKey(key)) {
          removed.put(key, records.remove(key));
        }
      }
      if (!removed.isEmpty()) {
        write(table, records);
      }
    } finally {
      lock.unlock();
    }
    notifier.recordDelete(table, requested, removed);
  }

  @Override
  public void clear(String table) {
    guard.check(table);
    Map<String, JsonNode> snapshot;
    lock.lock();
    try {
      snapshot = read(table);
      write(table, Map.of());
    } finally {
      lock.unlock();
    }
    notifier.recordClear(table, snapshot);
  }

  @Override
  public Subscription subscribe(StoreListener listener) {
    return notifier.subscribe(listener);
  }

  @Override
  public void close() {
    guard.close();
  }

  private Map<String, JsonNode> read(String table) {
    Path document = documentPath(table);
    try {
      return StorageDocuments.read(document, jsonCodec);
    } catch (IOException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to read table " + table + " from " + document, e);
      return new LinkedHashMap<>();
    }
  }

  private void write(String table, Map<String, JsonNode> records) {
    Path document = documentPath(table);
    try {
      StorageDocuments.write(document, records, jsonCodec);
    } catch (IOException e) {
      logger.log(Level.SEVERE, "Failed to write table " + table + " to " + document, e);
      throw new StoreException("Failed to write table " + table, e);
    }
  }

  /**
   * Builder for {@link FileKeyValueStore}.
   */
  public static final class Builder {
    private Path path;
    private String extension;
    private Collection<String> tables;
    private JsonCodec jsonCodec;

    private Builder() {
    }

    /** Root directory; defaults to {@code ./database/}. */
    public Builder path(Path path) {
      this.path = path;
      return this;
    }

    /** Document file extension including the dot; defaults to {@code .json}. */
    public Builder extension(String extension) {
      this.extension = extension;
      return this;
    }

    /** Tables to declare; {@code main} when empty. {@code timeout} is always added. */
    public Builder tables(Collection<String> tables) {
      this.tables = tables;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public FileKeyValueStore build() {
      return new FileKeyValueStore(this);
    }
  }
}
