package kvstore.firestore;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.cloud.NoCredentials;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import kvstore.ChangeEvent;
import kvstore.ChangeListener;
import kvstore.timeout.TimeoutManager;
import kvstore.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.FirestoreEmulatorContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class FirestoreKeyValueStoreIntegrationTest {

  @Container
  static final FirestoreEmulatorContainer emulator = new FirestoreEmulatorContainer(
      DockerImageName.parse("gcr.io/google.com/cloudsdktool/google-cloud-cli:441.0.0-emulators"));

  private FirestoreOptions options;
  private FirestoreKeyValueStore store;
  private final List<ChangeEvent> events = new ArrayList<>();

  private static JsonNode json(String text) {
    return JsonCodec.getDefault().parse(text);
  }

  @BeforeEach
  void setUp() {
    // a project per test keeps the shared emulator's data apart
    options = FirestoreOptions.getDefaultInstance().toBuilder()
        .setHost(emulator.getEmulatorEndpoint())
        .setCredentials(NoCredentials.getInstance())
        .setProjectId("p" + UUID.randomUUID().toString().replace("-", "").substring(0, 20))
        .build();
    store = FirestoreKeyValueStore.builder()
        .options(options)
        .tables(List.of("main", "users"))
        .build();
    store.subscribe((ChangeListener) events::add);
    store.connect();
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  @Test
  void connectIsReadyWithTimeoutTable() {
    assertTrue(store.isReady());
    assertEquals(List.of("main", "users", "timeout"), store.tables());
  }

  @Test
  void documentsHoldKeyAndJsonText() throws Exception {
    store.set("users", "team/ann", json("{\"age\":30}"));

    try (Firestore firestore = options.getService()) {
      DocumentSnapshot doc = firestore.collection("users").document("team%2Fann").get().get();
      assertTrue(doc.exists());
      assertEquals("team/ann", doc.getString("key"));
      assertEquals(30, json(doc.getString("value")).get("age").asInt());
    }
    assertEquals(Map.of("team/ann", json("{\"age\":30}")), store.all("users"));
  }

  @Test
  void createUpdateAndSuppressedWrite() {
    store.set("main", "a", json("{\"n\":1}"));
    store.set("main", "a", json("{\"n\":1.0}"));
    store.set("main", "a", json("{\"n\":2}"));

    assertEquals(2, events.size());
    assertInstanceOf(ChangeEvent.Create.class, events.get(0));
    ChangeEvent.Update update = assertInstanceOf(ChangeEvent.Update.class, events.get(1));
    assertEquals(2, update.newData().get("n").asInt());
  }

  @Test
  void deleteAndClearReportRemovedValues() {
    store.set("main", "a", json("1")).set("main", "b", json("2"));
    events.clear();

    store.delete("main", List.of("a", "ghost"));
    store.clear("main");

    assertEquals(new ChangeEvent.Delete("main", List.of("a", "ghost"), Map.of("a", json("1"))), events.get(0));
    assertEquals(new ChangeEvent.ClearAll("main", Map.of("b", json("2"))), events.get(1));
    assertTrue(store.all("main").isEmpty());
  }

  @Test
  void deleteWithRepeatedKeyRemovesItOnce() {
    store.set("main", "a", json("1")).set("main", "b", json("2"));
    events.clear();

    store.delete("main", List.of("a", "a", "b"));

    assertEquals(new ChangeEvent.Delete("main", List.of("a", "a", "b"),
        Map.of("a", json("1"), "b", json("2"))), events.get(0));
    assertTrue(store.all("main").isEmpty());
  }

  @Test
  void timeoutsFireThroughFirestore() throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    try (TimeoutManager manager = TimeoutManager.builder().store(store).build()) {
      manager.registerTimeout("ping", record -> latch.countDown());
      manager.start();
      String key = manager.addTimeout("ping", 100, json("{\"x\":1}"));

      assertTrue(store.has("timeout", key));
      assertTrue(latch.await(10, TimeUnit.SECONDS));
    }
  }
}
