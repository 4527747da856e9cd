/**
 * Google Cloud Firestore backend.
 *
 * <pre>{@code
 * FirestoreOptions options = FirestoreOptions.getDefaultInstance().toBuilder()
 *     .setProjectId("my-project")
 *     .build();
 * KeyValueStore store = FirestoreKeyValueStore.builder().options(options).build();
 * store.connect();
 * }</pre>
 */
package kvstore.firestore;
