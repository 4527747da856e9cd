package kvstore.jdbc.dialect;

import kvstore.jdbc.spi.Dialect;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DialectsTest {

  @Test
  void allReturnsBuiltInDialects() {
    List<Dialect> dialects = Dialects.all();

    assertTrue(dialects.size() >= 3);
    assertTrue(dialects.stream().anyMatch(d -> d.name().equals("mysql")));
    assertTrue(dialects.stream().anyMatch(d -> d.name().equals("postgresql")));
    assertTrue(dialects.stream().anyMatch(d -> d.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", Dialects.get("MySQL").name());
    assertEquals("postgresql", Dialects.get("POSTGRESQL").name());
    assertEquals("h2", Dialects.get("h2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Dialects.get("oracle"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("mysql", Dialects.detect("jdbc:mysql://localhost:3306/db").name());
    assertEquals("mysql", Dialects.detect("jdbc:mariadb://localhost:3306/db").name());
    assertEquals("postgresql", Dialects.detect("jdbc:postgresql://localhost/db").name());
    assertEquals("h2", Dialects.detect("jdbc:h2:mem:test").name());
  }

  @Test
  void detectFromUnknownOrEmptyUrlThrows() {
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect("jdbc:oracle:thin:@x"));
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect(""));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:detect_test");

    assertEquals("h2", Dialects.detect(ds).name());
  }

  @Test
  void upsertStatementsUseNativeSyntax() {
    assertTrue(new H2Dialect().upsertSql("t").startsWith("MERGE INTO t"));
    assertTrue(new MySqlDialect().upsertSql("t").contains("ON DUPLICATE KEY UPDATE"));
    assertTrue(new PostgresDialect().upsertSql("t").contains("ON CONFLICT (kv_key)"));
    assertEquals("DELETE FROM t WHERE kv_key=?", new PostgresDialect().deleteSql("t"));
  }
}
