package kvstore.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import kvstore.ChangeEvent;
import kvstore.ChangeListener;
import kvstore.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract checks run against real databases. Subclasses provide the DataSource.
 */
abstract class AbstractJdbcKeyValueStoreIntegrationTest {

  abstract DataSource dataSource();

  abstract String expectedDialect();

  private JdbcKeyValueStore store;
  private final List<ChangeEvent> events = new ArrayList<>();

  private static JsonNode json(String text) {
    return JsonCodec.getDefault().parse(text);
  }

  @BeforeEach
  void setUp() throws Exception {
    store = JdbcKeyValueStore.builder()
        .dataSource(dataSource())
        .tablePrefix("it_")
        .tables(List.of("main", "users"))
        .build();
    store.subscribe((ChangeListener) events::add);
    store.connect();
  }

  @AfterEach
  void dropTables() throws Exception {
    store.close();
    try (Connection conn = dataSource().getConnection(); Statement st = conn.createStatement()) {
      for (String table : List.of("main", "users", "timeout")) {
        st.execute("DROP TABLE IF EXISTS it_" + table);
      }
    }
  }

  @Test
  void detectsDialectFromUrl() {
    assertEquals(expectedDialect(), store.dialect().name());
  }

  @Test
  void upsertEmitsCreateThenUpdate() {
    store.set("main", "a", json("{\"n\":1}"));
    store.set("main", "a", json("{\"n\":1}"));
    store.set("main", "a", json("{\"n\":2}"));

    assertEquals(2, events.size());
    assertInstanceOf(ChangeEvent.Create.class, events.get(0));
    ChangeEvent.Update update = assertInstanceOf(ChangeEvent.Update.class, events.get(1));
    assertEquals(1, update.oldData().get("n").asInt());
    assertEquals(2, store.get("main", "a").orElseThrow().get("n").asInt());
  }

  @Test
  void storesNestedJsonAndUnicode() {
    JsonNode value = json("{\"name\":\"Zoë ✓\",\"tags\":[1,2,{\"deep\":null}]}");

    store.set("users", "u1", value);

    assertEquals(value, store.get("users", "u1").orElseThrow());
  }

  @Test
  void deleteAndClear() {
    store.set("main", "a", json("1")).set("main", "b", json("2")).set("main", "c", json("3"));
    events.clear();

    store.delete("main", List.of("a", "missing"));
    ChangeEvent.Delete delete = assertInstanceOf(ChangeEvent.Delete.class, events.get(0));
    assertEquals(List.of("a", "missing"), delete.keys());
    assertEquals(Map.of("a", json("1")), delete.data());

    store.clear("main");
    ChangeEvent.ClearAll clear = assertInstanceOf(ChangeEvent.ClearAll.class, events.get(1));
    assertEquals(Map.of("b", json("2"), "c", json("3")), clear.records());
    assertTrue(store.all("main").isEmpty());
  }

  @Test
  void tablesAreIsolated() {
    store.set("main", "k", json("1"));
    store.set("users", "k", json("2"));

    assertEquals(Map.of("k", json("1")), store.all("main"));
    assertEquals(Map.of("k", json("2")), store.all("users"));
  }
}
