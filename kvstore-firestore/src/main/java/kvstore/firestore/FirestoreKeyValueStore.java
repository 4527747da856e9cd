package kvstore.firestore;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.api.core.ApiFuture;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.WriteBatch;
import kvstore.KeyValueStore;
import kvstore.StoreConnectionException;
import kvstore.StoreException;
import kvstore.StoreListener;
import kvstore.Subscription;
import kvstore.support.ChangeNotifier;
import kvstore.support.StoreGuard;
import kvstore.util.JsonCodec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link KeyValueStore} backed by Google Cloud Firestore, one collection per table.
 *
 * <p>Each record is a document whose id is the URL-encoded key, with fields {@code key}
 * (the original key) and {@code value} (JSON text). Writes and single deletes run in
 * Firestore transactions so the reported previous value is the one replaced. Multi-key
 * deletes and clears are split into chunks of at most {@value #MAX_BATCH_SIZE} writes,
 * the Firestore per-commit limit.
 *
 * <p>A client built from {@link Builder#options(FirestoreOptions)} is owned and closed by
 * {@link #close()}; a client passed via {@link Builder#firestore(Firestore)} is not.
 */
public final class FirestoreKeyValueStore implements KeyValueStore {
  private static final Logger logger = Logger.getLogger(FirestoreKeyValueStore.class.getName());

  static final int MAX_BATCH_SIZE = 500;
  static final String KEY_FIELD = "key";
  static final String VALUE_FIELD = "value";

  private final FirestoreOptions options;
  private final boolean ownsClient;
  private final JsonCodec jsonCodec;
  private final StoreGuard guard;
  private final ChangeNotifier notifier = new ChangeNotifier();

  private volatile Firestore firestore;

  private FirestoreKeyValueStore(Builder builder) {
    if (builder.firestore == null && builder.options == null) {
      throw new NullPointerException("firestore or options");
    }
    this.firestore = builder.firestore;
    this.options = builder.options;
    this.ownsClient = builder.firestore == null;
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.guard = new StoreGuard("FirestoreKeyValueStore", builder.tables);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public synchronized void connect() {
    if (guard.isReady()) {
      return;
    }
    try {
      if (firestore == null) {
        firestore = options.getService();
      }
      for (String table : guard.tables()) {
        await(firestore.collection(table).limit(1).get(), "check collection " + table);
      }
    } catch (RuntimeException e) {
      throw new StoreConnectionException("Failed to reach Firestore", e);
    }
    if (guard.markReady()) {
      logger.log(Level.INFO, "Firestore store ready on project {0} with tables {1}",
          new Object[]{firestore.getOptions().getProjectId(), guard.tables()});
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
    try {
      return valueOf(await(document(table, key).get(), "read " + table + "/" + key));
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to read " + table + "/" + key, e);
      return Optional.empty();
    }
  }

  @Override
  public KeyValueStore set(String table, String key, JsonNode value) {
    guard.check(table);
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    DocumentReference ref = document(table, key);
    Map<String, Object> fields = Map.of(KEY_FIELD, key, VALUE_FIELD, jsonCodec.toJson(value));
    Optional<JsonNode> previous;
    try {
      previous = await(firestore.runTransaction(tx -> {
        DocumentSnapshot snapshot = tx.get(ref).get();
        tx.set(ref, fields);
        return valueOf(snapshot);
      }), "write " + table + "/" + key);
    } catch (StoreException e) {
      logger.log(Level.SEVERE, "Failed to write " + table + "/" + key, e);
      throw e;
    }
    notifier.recordWrite(table, key, previous, value);
    return this;
  }

  @Override
  public boolean has(String table, String key) {
    return get(table, key).isPresent();
  }

  @Override
  public Map<String, JsonNode> all(String table) {
    guard.check(table);
    try {
      return Collections.unmodifiableMap(snapshot(table));
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to read table " + table, e);
      return Map.of();
    }
  }

  @Override
  public void delete(String table, Collection<String> keys) {
    guard.check(table);
    List<String> requested = List.copyOf(keys);
    Map<String, JsonNode> removed = new LinkedHashMap<>();
    try {
      for (List<String> chunk : chunks(requested)) {
        Map<String, JsonNode> chunkRemoved = await(firestore.runTransaction(tx -> {
          Map<String, JsonNode> found = new LinkedHashMap<>();
          List<DocumentReference> refs = new ArrayList<>();
          for (String key : new LinkedHashSet<>(chunk)) {
            DocumentReference ref = document(table, key);
            Optional<JsonNode> previous = valueOf(tx.get(ref).get());
            if (previous.isPresent()) {
              found.put(key, previous.get());
              refs.add(ref);
            }
          }
          refs.forEach(tx::delete);
          return found;
        }), "delete from " + table);
        removed.putAll(chunkRemoved);
      }
    } catch (StoreException e) {
      logger.log(Level.SEVERE, "Failed to delete from " + table, e);
      throw e;
    }
    notifier.recordDelete(table, requested, removed);
  }

  @Override
  public void clear(String table) {
    guard.check(table);
    Map<String, JsonNode> removed = new LinkedHashMap<>();
    try {
      List<QueryDocumentSnapshot> documents =
          await(collection(table).get(), "read table " + table).getDocuments();
      for (List<QueryDocumentSnapshot> chunk : chunks(documents)) {
        WriteBatch batch = firestore.batch();
        for (QueryDocumentSnapshot document : chunk) {
          batch.delete(document.getReference());
        }
        await(batch.commit(), "clear " + table);
        for (QueryDocumentSnapshot document : chunk) {
          entryOf(table, document).ifPresent(e -> removed.put(e.getKey(), e.getValue()));
        }
      }
    } catch (StoreException e) {
      logger.log(Level.SEVERE, "Failed to clear " + table, e);
      throw e;
    }
    notifier.recordClear(table, removed);
  }

  @Override
  public Subscription subscribe(StoreListener listener) {
    return notifier.subscribe(listener);
  }

  @Override
  public synchronized void close() {
    guard.close();
    if (ownsClient && firestore != null) {
      try {
        firestore.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to close Firestore client", e);
      }
      firestore = null;
    }
  }

  private CollectionReference collection(String table) {
    return firestore.collection(table);
  }

  private DocumentReference document(String table, String key) {
    return collection(table).document(DocumentIds.of(key));
  }

  private Map<String, JsonNode> snapshot(String table) {
    Map<String, JsonNode> records = new LinkedHashMap<>();
    for (QueryDocumentSnapshot document : await(collection(table).get(), "read table " + table).getDocuments()) {
      entryOf(table, document).ifPresent(e -> records.put(e.getKey(), e.getValue()));
    }
    return records;
  }

  private Optional<Map.Entry<String, JsonNode>> entryOf(String table, DocumentSnapshot document) {
    String key = document.getString(KEY_FIELD);
    Optional<JsonNode> value = valueOf(document);
    if (key == null || value.isEmpty()) {
      logger.log(Level.WARNING, "Skipping malformed document {0}/{1}",
          new Object[]{table, document.getId()});
      return Optional.empty();
    }
    return Optional.of(Map.entry(key, value.get()));
  }

  private Optional<JsonNode> valueOf(DocumentSnapshot document) {
    if (document == null || !document.exists()) {
      return Optional.empty();
    }
    String json = document.getString(VALUE_FIELD);
    if (json == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(jsonCodec.parse(json));
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Unreadable value in document {0}: {1}",
          new Object[]{document.getId(), e.getMessage()});
      return Optional.empty();
    }
  }

  static <T> List<List<T>> chunks(List<T> items) {
    List<List<T>> chunks = new ArrayList<>();
    for (int i = 0; i < items.size(); i += MAX_BATCH_SIZE) {
      chunks.add(items.subList(i, Math.min(items.size(), i + MAX_BATCH_SIZE)));
    }
    return chunks;
  }

  private static <T> T await(ApiFuture<T> future, String operation) {
    try {
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new StoreException("Failed to " + operation, cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException("Interrupted while trying to " + operation, e);
    }
  }

  /**
   * Builder for {@link FirestoreKeyValueStore}.
   */
  public static final class Builder {
    private FirestoreOptions options;
    private Firestore firestore;
    private Collection<String> tables;
    private JsonCodec jsonCodec;

    private Builder() {
    }

    /** Options used to create a client owned by the store. */
    public Builder options(FirestoreOptions options) {
      this.options = options;
      return this;
    }

    /** Externally managed client; not closed by the store. */
    public Builder firestore(Firestore firestore) {
      this.firestore = firestore;
      return this;
    }

    public Builder tables(Collection<String> tables) {
      this.tables = tables;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public FirestoreKeyValueStore build() {
      return new FirestoreKeyValueStore(this);
    }
  }
}
