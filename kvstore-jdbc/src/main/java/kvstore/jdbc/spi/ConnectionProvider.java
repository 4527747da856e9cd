package kvstore.jdbc.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the relational store.
 *
 * <p>Each store operation borrows one connection and closes it when done; a pooled
 * {@code DataSource} fits via {@code dataSource::getConnection}.
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
