package kvstore.jdbc.dialect;

import kvstore.jdbc.spi.Dialect;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses supply the DDL and the upsert statement, which have no portable form.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String selectSql(String table) {
    return "SELECT kv_value FROM " + table + " WHERE kv_key=?";
  }

  @Override
  public String selectAllSql(String table) {
    return "SELECT kv_key, kv_value FROM " + table + " ORDER BY kv_key";
  }

  @Override
  public String deleteSql(String table) {
    return "DELETE FROM " + table + " WHERE kv_key=?";
  }

  @Override
  public String clearSql(String table) {
    return "DELETE FROM " + table;
  }
}
