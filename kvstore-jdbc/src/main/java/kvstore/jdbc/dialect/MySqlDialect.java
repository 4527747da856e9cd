package kvstore.jdbc.dialect;

import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB and MariaDB.
 *
 * <p>Keys are limited to 191 characters so the primary key fits the utf8mb4 index limit.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table +
        " (kv_key VARCHAR(191) NOT NULL PRIMARY KEY, kv_value LONGTEXT NOT NULL)" +
        " DEFAULT CHARSET=utf8mb4";
  }

  @Override
  public String upsertSql(String table) {
    return "INSERT INTO " + table + " (kv_key, kv_value) VALUES (?, ?)" +
        " ON DUPLICATE KEY UPDATE kv_value=VALUES(kv_value)";
  }
}
