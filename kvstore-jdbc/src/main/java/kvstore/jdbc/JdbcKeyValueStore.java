package kvstore.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import kvstore.KeyValueStore;
import kvstore.StoreConnectionException;
import kvstore.StoreException;
import kvstore.StoreListener;
import kvstore.Subscription;
import kvstore.TableNames;
import kvstore.jdbc.dialect.Dialects;
import kvstore.jdbc.spi.ConnectionProvider;
import kvstore.jdbc.spi.Dialect;
import kvstore.support.ChangeNotifier;
import kvstore.support.StoreGuard;
import kvstore.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.AbstractMap;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link KeyValueStore} backed by relational tables.
 *
 * <p>Each logical table maps to one SQL table named {@code <tablePrefix><table>} with
 * columns {@code kv_key} (primary key) and {@code kv_value} (JSON text). Tables are
 * created with {@code CREATE TABLE IF NOT EXISTS} on {@link #connect()}.
 *
 * <p>Key length is bounded by the dialect's {@code kv_key} column: 1024 characters on H2,
 * unbounded on PostgreSQL, and 191 characters on MySQL, where the utf8mb4 primary key
 * must fit the InnoDB index limit. A longer key fails with a {@link StoreException}.
 *
 * <p>The SQL dialect is taken from the builder or detected from the JDBC URL on connect.
 * Deletes and clears read the rows they remove and remove them in one transaction.
 * The store does not own the connection pool; {@link #close()} leaves it open.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class JdbcKeyValueStore implements KeyValueStore {
  private static final Logger logger = Logger.getLogger(JdbcKeyValueStore.class.getName());

  private static final JdbcTemplate.RowMapper<String> VALUE_MAPPER = rs -> rs.getString("kv_value");

  private final ConnectionProvider connectionProvider;
  private final String tablePrefix;
  private final JsonCodec jsonCodec;
  private final StoreGuard guard;
  private final ChangeNotifier notifier = new ChangeNotifier();
  private volatile Dialect dialect;

  private JdbcKeyValueStore(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    String prefix = builder.tablePrefix == null ? "" : builder.tablePrefix;
    if (!prefix.isEmpty()) {
      TableNames.validate(prefix);
    }
    this.tablePrefix = prefix;
    this.dialect = builder.dialect;
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.guard = new StoreGuard("JdbcKeyValueStore", builder.tables);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The SQL table backing {@code table}. */
  public String physicalTable(String table) {
    return tablePrefix + table;
  }

  /** The dialect in use; {@code null} until detected on connect. */
  public Dialect dialect() {
    return dialect;
  }

  @Override
  public synchronized void connect() {
    if (guard.isReady()) {
      return;
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (dialect == null) {
        dialect = Dialects.detect(conn);
      }
      for (String table : guard.tables()) {
        JdbcTemplate.update(conn, dialect.createTableSql(physicalTable(table)));
      }
    } catch (SQLException | RuntimeException e) {
      throw new StoreConnectionException("Failed to connect relational store", e);
    }
    if (guard.markReady()) {
      logger.log(Level.INFO, "Relational store ready ({0}) with tables {1}",
          new Object[]{dialect.name(), guard.tables()});
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
    try (Connection conn = connectionProvider.getConnection()) {
      return selectValue(conn, table, key);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to read " + table + "/" + key, e);
      return Optional.empty();
    }
  }

  @Override
  public KeyValueStore set(String table, String key, JsonNode value) {
    guard.check(table);
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    Optional<JsonNode> previous;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      previous = selectValue(conn, table, key);
      JdbcTemplate.update(conn, dialect.upsertSql(physicalTable(table)), key, jsonCodec.toJson(value));
    } catch (SQLException | RuntimeException e) {
      throw writeFailure("write " + table + "/" + key, e);
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
    try (Connection conn = connectionProvider.getConnection()) {
      return Collections.unmodifiableMap(selectAll(conn, table));
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to read table " + table, e);
      return Map.of();
    }
  }

  @Override
  public void delete(String table, Collection<String> keys) {
    guard.check(table);
    List<String> requested = List.copyOf(keys);
    Map<String, JsonNode> removed = new LinkedHashMap<>();
    inTransaction("delete from " + table, conn -> {
      for (String key : requested) {
        Optional<JsonNode> previous = selectValue(conn, table, key);
        if (previous.isPresent()) {
          JdbcTemplate.update(conn, dialect.deleteSql(physicalTable(table)), key);
          removed.put(key, previous.get());
        }
      }
    });
    notifier.recordDelete(table, requested, removed);
  }

  @Override
  public void clear(String table) {
    guard.check(table);
    Map<String, JsonNode> snapshot = new LinkedHashMap<>();
    inTransaction("clear " + table, conn -> {
      snapshot.putAll(selectAll(conn, table));
      JdbcTemplate.update(conn, dialect.clearSql(physicalTable(table)));
    });
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

  private Optional<JsonNode> selectValue(Connection conn, String table, String key) {
    return JdbcTemplate.queryOne(conn, dialect.selectSql(physicalTable(table)), VALUE_MAPPER, key)
        .map(jsonCodec::parse);
  }

  private Map<String, JsonNode> selectAll(Connection conn, String table) {
    Map<String, JsonNode> records = new LinkedHashMap<>();
    List<Map.Entry<String, String>> rows = JdbcTemplate.query(conn,
        dialect.selectAllSql(physicalTable(table)),
        rs -> new AbstractMap.SimpleImmutableEntry<>(rs.getString("kv_key"), rs.getString("kv_value")));
    for (Map.Entry<String, String> row : rows) {
      try {
        records.put(row.getKey(), jsonCodec.parse(row.getValue()));
      } catch (IllegalArgumentException e) {
        logger.log(Level.WARNING, "Skipping unreadable value {0}/{1}: {2}",
            new Object[]{table, row.getKey(), e.getMessage()});
      }
    }
    return records;
  }

  private void inTransaction(String operation, ConnectionWork work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        work.run(conn);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException | RuntimeException e) {
      throw writeFailure(operation, e);
    }
  }

  private static StoreException writeFailure(String operation, Exception e) {
    logger.log(Level.SEVERE, "Failed to " + operation, e);
    if (e instanceof StoreException se) {
      return se;
    }
    return new StoreException("Failed to " + operation, e);
  }

  @FunctionalInterface
  private interface ConnectionWork {
    void run(Connection conn) throws SQLException;
  }

  /**
   * Builder for {@link JdbcKeyValueStore}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Dialect dialect;
    private String tablePrefix;
    private Collection<String> tables;
    private JsonCodec jsonCodec;

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** Shortcut for {@code connectionProvider(dataSource::getConnection)}. The pool is not closed by the store. */
    public Builder dataSource(DataSource dataSource) {
      this.connectionProvider = Objects.requireNonNull(dataSource, "dataSource")::getConnection;
      return this;
    }

    /** Dialect to use; detected from the JDBC URL when not set. */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /** Prefix prepended to every SQL table name, e.g. {@code "kv_"}. */
    public Builder tablePrefix(String tablePrefix) {
      this.tablePrefix = tablePrefix;
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

    public JdbcKeyValueStore build() {
      return new JdbcKeyValueStore(this);
    }
  }
}
