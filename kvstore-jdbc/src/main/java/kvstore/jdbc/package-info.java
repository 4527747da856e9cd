/**
 * Relational backend: {@link kvstore.jdbc.JdbcKeyValueStore} with a pluggable
 * {@linkplain kvstore.jdbc.spi.Dialect dialect} per database.
 *
 * <pre>{@code
 * KeyValueStore store = JdbcKeyValueStore.builder()
 *     .dataSource(dataSource)
 *     .tablePrefix("kv_")
 *     .tables(List.of("main", "users"))
 *     .build();
 * store.connect();
 * }</pre>
 */
package kvstore.jdbc;
