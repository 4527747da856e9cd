package kvstore.spring.boot;

import kvstore.KeyValueStore;
import kvstore.jdbc.JdbcKeyValueStore;
import kvstore.jdbc.dialect.Dialects;

import javax.sql.DataSource;

/**
 * Builds the JDBC backend. Kept apart so {@code kvstore-jdbc} stays optional.
 */
final class JdbcStoreFactory {

  private JdbcStoreFactory() {}

  static KeyValueStore create(KvStoreProperties props, DataSource dataSource) {
    KvStoreProperties.Jdbc jdbc = props.getJdbc();
    JdbcKeyValueStore.Builder builder = JdbcKeyValueStore.builder()
        .dataSource(dataSource)
        .tablePrefix(jdbc.getTablePrefix())
        .tables(props.getTables());
    if (jdbc.getDialect() != null && !jdbc.getDialect().isEmpty()) {
      builder.dialect(Dialects.get(jdbc.getDialect()));
    }
    return builder.build();
  }
}
