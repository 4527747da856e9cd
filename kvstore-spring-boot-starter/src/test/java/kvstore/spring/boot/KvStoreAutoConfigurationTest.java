package kvstore.spring.boot;

import com.fasterxml.jackson.databind.JsonNode;
import kvstore.KeyValueStore;
import kvstore.file.FileKeyValueStore;
import kvstore.jdbc.JdbcKeyValueStore;
import kvstore.timeout.TimeoutAction;
import kvstore.timeout.TimeoutManager;
import kvstore.timeout.TimeoutRecord;
import kvstore.util.JsonCodec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class KvStoreAutoConfigurationTest {

  @TempDir
  Path dir;

  private ApplicationContextRunner fileRunner() {
    return new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(KvStoreAutoConfiguration.class))
        .withPropertyValues("kvstore.file.path=" + dir);
  }

  private static JsonNode json(String text) {
    return JsonCodec.getDefault().parse(text);
  }

  @Test
  void createsAllBeansForFileStore() {
    fileRunner().withPropertyValues("kvstore.tables=main,users").run(ctx -> {
      assertTrue(ctx.containsBean("keyValueStore"));
      assertTrue(ctx.containsBean("timeoutManager"));
      assertTrue(ctx.containsBean("timeoutHandlerRegistrar"));
      assertTrue(ctx.containsBean("kvStoreLifecycle"));

      KeyValueStore store = ctx.getBean(KeyValueStore.class);
      assertInstanceOf(FileKeyValueStore.class, store);
      assertEquals(List.of("main", "users", "timeout"), store.tables());
      assertTrue(store.isReady());
      assertTrue(Files.exists(dir.resolve("users.json")));
    });
  }

  @Test
  void autoStartupCanBeDisabled() {
    fileRunner().withPropertyValues("kvstore.auto-startup=false").run(ctx -> {
      assertFalse(ctx.getBean(KeyValueStore.class).isReady());
    });
  }

  @Test
  void jdbcStoreUsesDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            KvStoreAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:kvstore_auto_test;DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver",
            "kvstore.type=JDBC")
        .run(ctx -> {
          var store = assertInstanceOf(JdbcKeyValueStore.class, ctx.getBean(KeyValueStore.class));
          assertTrue(store.isReady());
          assertEquals("h2", store.dialect().name());
          assertEquals("kv_main", store.physicalTable("main"));

          store.set("main", "a", json("{\"n\":1}"));
          assertEquals(json("{\"n\":1}"), store.get("main", "a").orElseThrow());
        });
  }

  @Test
  void jdbcRequiresDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(KvStoreAutoConfiguration.class))
        .withPropertyValues("kvstore.type=JDBC")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void mongoRequiresUri() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(KvStoreAutoConfiguration.class))
        .withPropertyValues("kvstore.type=MONGO")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void firestoreRequiresProjectId() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(KvStoreAutoConfiguration.class))
        .withPropertyValues("kvstore.type=FIRESTORE")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    fileRunner().withUserConfiguration(CustomStoreConfig.class).run(ctx -> {
      assertEquals("customStore", ctx.getBeanNamesForType(KeyValueStore.class)[0]);
      assertEquals(List.of("custom", "timeout"), ctx.getBean(KeyValueStore.class).tables());
    });
  }

  @Test
  void overdueTimeoutFiresThroughAnnotatedHandler() throws Exception {
    TimeoutRecord overdue = new TimeoutRecord("reminder", 3000,
        System.currentTimeMillis() - 5000, json("{\"chat\":7}"));
    try (FileKeyValueStore seed = FileKeyValueStore.builder().path(dir).build()) {
      seed.connect();
      seed.set("timeout", overdue.key(), overdue.toJson());
    }

    fileRunner().withUserConfiguration(ReminderConfig.class).run(ctx -> {
      ReminderAction action = ctx.getBean(ReminderAction.class);
      assertTrue(action.latch.await(5, TimeUnit.SECONDS));
      assertEquals(overdue, action.fired.get(0));
      assertTrue(ctx.getBean(TimeoutManager.class).registeredIds().contains("reminder"));
    });
  }

  // ── Test configurations ──────────────────────────────────────

  @TimeoutHandler("reminder")
  static class ReminderAction implements TimeoutAction {
    final CountDownLatch latch = new CountDownLatch(1);
    final List<TimeoutRecord> fired = new CopyOnWriteArrayList<>();

    @Override
    public void execute(TimeoutRecord record) {
      fired.add(record);
      latch.countDown();
    }
  }

  @Configuration
  static class ReminderConfig {
    @Bean
    ReminderAction reminderAction() {
      return new ReminderAction();
    }
  }

  @Configuration
  static class CustomStoreConfig {
    @Bean
    KeyValueStore customStore(@Value("${kvstore.file.path}") String path) {
      return FileKeyValueStore.builder().path(Path.of(path)).tables(List.of("custom")).build();
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
