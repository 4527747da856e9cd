package kvstore.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table +
        " (kv_key VARCHAR(1024) PRIMARY KEY, kv_value CLOB NOT NULL)";
  }

  @Override
  public String upsertSql(String table) {
    return "MERGE INTO " + table + " (kv_key, kv_value) KEY (kv_key) VALUES (?, ?)";
  }
}
