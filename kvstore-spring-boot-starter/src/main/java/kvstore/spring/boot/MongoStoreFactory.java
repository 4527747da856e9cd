package kvstore.spring.boot;

import com.mongodb.client.MongoClient;
import kvstore.KeyValueStore;
import kvstore.mongo.MongoKeyValueStore;
import org.springframework.beans.factory.ListableBeanFactory;

/**
 * Builds the MongoDB backend. Uses {@code kvstore.mongo.uri} when set, otherwise an
 * existing {@link MongoClient} bean.
 */
final class MongoStoreFactory {

  private MongoStoreFactory() {}

  static KeyValueStore create(KvStoreProperties props, ListableBeanFactory beanFactory) {
    KvStoreProperties.Mongo mongo = props.getMongo();
    MongoKeyValueStore.Builder builder = MongoKeyValueStore.builder()
        .database(mongo.getDatabase())
        .tables(props.getTables());
    if (mongo.getUri() != null && !mongo.getUri().isEmpty()) {
      builder.connectionString(mongo.getUri());
    } else {
      MongoClient client = beanFactory.getBeanProvider(MongoClient.class).getIfAvailable();
      if (client == null) {
        throw new IllegalStateException("kvstore.mongo.uri must be set for the MONGO store type");
      }
      builder.client(client);
    }
    return builder.build();
  }
}
