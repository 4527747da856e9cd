package kvstore.jdbc.spi;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Each logical table maps to one SQL table with two columns: {@code kv_key}
 * (primary key) and {@code kv_value} (JSON text). Implementations supply the SQL that
 * differs between databases; {@link kvstore.jdbc.dialect.AbstractDialect} provides the
 * standard statements.
 *
 * <p>Register custom dialects via {@code META-INF/services/kvstore.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB, MariaDB), PostgreSQL, H2.
 *
 * @see kvstore.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * DDL creating the table if it does not exist.
   */
  String createTableSql(String table);

  /**
   * Insert-or-replace of one record.
   *
   * <p>Parameters: kv_key (String), kv_value (String/JSON)
   */
  String upsertSql(String table);

  /**
   * Parameters: kv_key (String). Returns column kv_value.
   */
  String selectSql(String table);

  /**
   * Returns columns kv_key, kv_value for every row.
   */
  String selectAllSql(String table);

  /**
   * Parameters: kv_key (String)
   */
  String deleteSql(String table);

  String clearSql(String table);
}
