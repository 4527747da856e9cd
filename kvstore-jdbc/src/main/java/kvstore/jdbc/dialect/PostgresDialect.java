package kvstore.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table +
        " (kv_key TEXT PRIMARY KEY, kv_value TEXT NOT NULL)";
  }

  @Override
  public String upsertSql(String table) {
    return "INSERT INTO " + table + " (kv_key, kv_value) VALUES (?, ?)" +
        " ON CONFLICT (kv_key) DO UPDATE SET kv_value = EXCLUDED.kv_value";
  }
}
