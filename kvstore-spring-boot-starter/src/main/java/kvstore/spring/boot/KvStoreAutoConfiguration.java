package kvstore.spring.boot;

import kvstore.KeyValueStore;
import kvstore.file.FileKeyValueStore;
import kvstore.spi.MetricsExporter;
import kvstore.timeout.TimeoutManager;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.ClassUtils;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Auto-configuration for the key-value store.
 *
 * <p>Builds a {@link KeyValueStore} for the backend selected by {@code kvstore.type}, a
 * {@link TimeoutManager} on top of it, registers {@link TimeoutHandler @TimeoutHandler}
 * beans, and connects the store once the context has started.
 *
 * @see KvStoreProperties
 * @see KvStoreMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(KeyValueStore.class)
@EnableConfigurationProperties(KvStoreProperties.class)
public class KvStoreAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public KeyValueStore keyValueStore(KvStoreProperties props,
      ObjectProvider<DataSource> dataSourceProvider,
      ListableBeanFactory beanFactory) {
    return switch (props.getType()) {
      case FILE -> FileKeyValueStore.builder()
          .path(Path.of(props.getFile().getPath()))
          .extension(props.getFile().getExtension())
          .tables(props.getTables())
          .build();
      case JDBC -> {
        requireModule("kvstore.jdbc.JdbcKeyValueStore", "kvstore-jdbc", props.getType());
        DataSource dataSource = dataSourceProvider.getIfAvailable();
        if (dataSource == null) {
          throw new IllegalStateException("A DataSource bean is required for the JDBC store type");
        }
        yield JdbcStoreFactory.create(props, dataSource);
      }
      case MONGO -> {
        requireModule("kvstore.mongo.MongoKeyValueStore", "kvstore-mongo", props.getType());
        yield MongoStoreFactory.create(props, beanFactory);
      }
      case FIRESTORE -> {
        requireModule("kvstore.firestore.FirestoreKeyValueStore", "kvstore-firestore", props.getType());
        yield FirestoreStoreFactory.create(props);
      }
    };
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public TimeoutManager timeoutManager(KeyValueStore keyValueStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    TimeoutManager.Builder builder = TimeoutManager.builder().store(keyValueStore);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public TimeoutHandlerRegistrar timeoutHandlerRegistrar(ListableBeanFactory beanFactory,
      TimeoutManager timeoutManager) {
    return new TimeoutHandlerRegistrar(beanFactory, timeoutManager);
  }

  @Bean
  @ConditionalOnMissingBean
  public KvStoreLifecycle kvStoreLifecycle(KeyValueStore keyValueStore,
      TimeoutManager timeoutManager, KvStoreProperties props) {
    return new KvStoreLifecycle(keyValueStore, timeoutManager, props);
  }

  private static void requireModule(String className, String artifactId, KvStoreProperties.Type type) {
    if (!ClassUtils.isPresent(className, KvStoreAutoConfiguration.class.getClassLoader())) {
      throw new IllegalStateException(
          artifactId + " must be on the classpath for the " + type + " store type");
    }
  }
}
