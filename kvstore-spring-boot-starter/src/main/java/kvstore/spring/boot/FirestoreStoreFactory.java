package kvstore.spring.boot;

import com.google.cloud.NoCredentials;
import com.google.cloud.firestore.FirestoreOptions;
import kvstore.KeyValueStore;
import kvstore.firestore.FirestoreKeyValueStore;

/**
 * Builds the Firestore backend from {@code kvstore.firestore.*}.
 */
final class FirestoreStoreFactory {

  private FirestoreStoreFactory() {}

  static KeyValueStore create(KvStoreProperties props) {
    KvStoreProperties.Firestore firestore = props.getFirestore();
    if (firestore.getProjectId() == null || firestore.getProjectId().isEmpty()) {
      throw new IllegalStateException(
          "kvstore.firestore.project-id must be set for the FIRESTORE store type");
    }
    FirestoreOptions.Builder options = FirestoreOptions.getDefaultInstance().toBuilder()
        .setProjectId(firestore.getProjectId());
    if (firestore.getEmulatorHost() != null && !firestore.getEmulatorHost().isEmpty()) {
      options.setHost(firestore.getEmulatorHost())
          .setCredentials(NoCredentials.getInstance());
    }
    return FirestoreKeyValueStore.builder()
        .options(options.build())
        .tables(props.getTables())
        .build();
  }
}
