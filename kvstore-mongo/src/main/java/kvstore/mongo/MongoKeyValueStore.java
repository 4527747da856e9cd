package kvstore.mongo;

import com.fasterxml.jackson.databind.JsonNode;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndReplaceOptions;
import com.mongodb.client.model.ReturnDocument;
import kvstore.KeyValueStore;
import kvstore.StoreConnectionException;
import kvstore.StoreException;
import kvstore.StoreListener;
import kvstore.Subscription;
import kvstore.support.ChangeNotifier;
import kvstore.support.StoreGuard;
import kvstore.util.JsonCodec;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.Document;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link KeyValueStore} backed by MongoDB, one collection per table.
 *
 * <p>Documents have the shape {@code {_id: <key>, key: <key>, value: <native BSON>}},
 * so values stay queryable with ordinary MongoDB tools. {@link #connect()} pings the
 * server and creates missing collections.
 *
 * <p>Writes use {@code findOneAndReplace} / {@code findOneAndDelete}, so the previous
 * value reported in change events is the one the server actually replaced.
 *
 * <p>A client built from {@link Builder#connectionString(String)} is owned and closed by
 * {@link #close()}; a client passed via {@link Builder#client(MongoClient)} is not.
 */
public final class MongoKeyValueStore implements KeyValueStore {
  private static final Logger logger = Logger.getLogger(MongoKeyValueStore.class.getName());

  private static final FindOneAndReplaceOptions UPSERT_RETURN_BEFORE = new FindOneAndReplaceOptions()
      .upsert(true)
      .returnDocument(ReturnDocument.BEFORE);

  private final String connectionString;
  private final String databaseName;
  private final boolean ownsClient;
  private final JsonCodec jsonCodec;
  private final StoreGuard guard;
  private final ChangeNotifier notifier = new ChangeNotifier();

  private volatile MongoClient client;
  private volatile MongoDatabase database;

  private MongoKeyValueStore(Builder builder) {
    if (builder.client == null && builder.connectionString == null) {
      throw new NullPointerException("client or connectionString");
    }
    this.databaseName = Objects.requireNonNull(builder.database, "database");
    if (databaseName.isBlank()) {
      throw new IllegalArgumentException("database must not be blank");
    }
    this.client = builder.client;
    this.connectionString = builder.connectionString;
    this.ownsClient = builder.client == null;
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.guard = new StoreGuard("MongoKeyValueStore", builder.tables);
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
      if (client == null) {
        client = MongoClients.create(connectionString);
      }
      MongoDatabase db = client.getDatabase(databaseName);
      db.runCommand(new Document("ping", 1));
      Set<String> existing = db.listCollectionNames().into(new HashSet<>());
      for (String table : guard.tables()) {
        if (!existing.contains(table)) {
          db.createCollection(table);
        }
      }
      database = db;
    } catch (MongoException | IllegalArgumentException e) {
      throw new StoreConnectionException("Failed to connect to MongoDB database " + databaseName, e);
    }
    if (guard.markReady()) {
      logger.log(Level.INFO, "MongoDB store ready on database {0} with tables {1}",
          new Object[]{databaseName, guard.tables()});
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
      BsonDocument document = collection(table).find(Filters.eq("_id", key)).first();
      return Optional.ofNullable(document).map(this::valueOf);
    } catch (MongoException | IllegalArgumentException e) {
      logger.log(Level.SEVERE, "Failed to read " + table + "/" + key, e);
      return Optional.empty();
    }
  }

  @Override
  public KeyValueStore set(String table, String key, JsonNode value) {
    guard.check(table);
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    BsonDocument previous;
    try {
      previous = collection(table).findOneAndReplace(Filters.eq("_id", key),
          toDocument(key, value), UPSERT_RETURN_BEFORE);
    } catch (MongoException | IllegalArgumentException e) {
      logger.log(Level.SEVERE, "Failed to write " + table + "/" + key, e);
      throw new StoreException("Failed to write " + table + "/" + key, e);
    }
    notifier.recordWrite(table, key, Optional.ofNullable(previous).map(this::valueOf), value);
    return this;
  }

  @Override
  public boolean has(String table, String key) {
    guard.check(table);
    try {
      return collection(table).countDocuments(Filters.eq("_id", key)) > 0;
    } catch (MongoException e) {
      logger.log(Level.SEVERE, "Failed to read " + table + "/" + key, e);
      return false;
    }
  }

  @Override
  public Map<String, JsonNode> all(String table) {
    guard.check(table);
    try {
      return Collections.unmodifiableMap(snapshot(table));
    } catch (MongoException e) {
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
      MongoCollection<BsonDocument> collection = collection(table);
      for (String key : requested) {
        BsonDocument previous = collection.findOneAndDelete(Filters.eq("_id", key));
        if (previous != null) {
          removed.put(key, valueOf(previous));
        }
      }
    } catch (MongoException e) {
      logger.log(Level.SEVERE, "Failed to delete from " + table, e);
      throw new StoreException("Failed to delete from " + table, e);
    }
    notifier.recordDelete(table, requested, removed);
  }

  @Override
  public void clear(String table) {
    guard.check(table);
    Map<String, JsonNode> removed;
    try {
      removed = snapshot(table);
      if (!removed.isEmpty()) {
        collection(table).deleteMany(Filters.in("_id", removed.keySet()));
      }
    } catch (MongoException e) {
      logger.log(Level.SEVERE, "Failed to clear " + table, e);
      throw new StoreException("Failed to clear " + table, e);
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
    if (ownsClient && client != null) {
      client.close();
      client = null;
    }
    database = null;
  }

  private MongoCollection<BsonDocument> collection(String table) {
    MongoDatabase db = database;
    if (db == null) {
      throw new StoreException("MongoDB store is closed");
    }
    return db.getCollection(table, BsonDocument.class);
  }

  private Map<String, JsonNode> snapshot(String table) {
    Map<String, JsonNode> records = new LinkedHashMap<>();
    for (BsonDocument document : collection(table).find()) {
      BsonValue id = document.get("_id");
      if (id == null || !id.isString()) {
        logger.log(Level.WARNING, "Skipping document without string _id in {0}", table);
        continue;
      }
      records.put(id.asString().getValue(), valueOf(document));
    }
    return records;
  }

  private BsonDocument toDocument(String key, JsonNode value) {
    return new BsonDocument("_id", new BsonString(key))
        .append("key", new BsonString(key))
        .append("value", BsonJson.toBson(value));
  }

  private JsonNode valueOf(BsonDocument document) {
    BsonValue value = document.get("value");
    return value == null ? jsonCodec.parse(null) : BsonJson.toJson(value);
  }

  /**
   * Builder for {@link MongoKeyValueStore}.
   */
  public static final class Builder {
    private String connectionString;
    private MongoClient client;
    private String database;
    private Collection<String> tables;
    private JsonCodec jsonCodec;

    private Builder() {
    }

    /** Connection URI such as {@code mongodb://localhost:27017}; the client is owned by the store. */
    public Builder connectionString(String connectionString) {
      this.connectionString = connectionString;
      return this;
    }

    /** Externally managed client; not closed by the store. */
    public Builder client(MongoClient client) {
      this.client = client;
      return this;
    }

    public Builder database(String database) {
      this.database = database;
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

    public MongoKeyValueStore build() {
      return new MongoKeyValueStore(this);
    }
  }
}
