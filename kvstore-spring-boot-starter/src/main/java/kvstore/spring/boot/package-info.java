/**
 * Spring Boot auto-configuration for the key-value store.
 *
 * <p>{@link kvstore.spring.boot.KvStoreAutoConfiguration} wires a
 * {@link kvstore.KeyValueStore} and a {@link kvstore.timeout.TimeoutManager} from
 * {@code kvstore.*} application properties. Supported backends: {@code FILE},
 * {@code JDBC}, {@code MONGO} and {@code FIRESTORE}.
 *
 * <p>Use {@link kvstore.spring.boot.TimeoutHandler @TimeoutHandler} on beans
 * to register timeout actions declaratively.
 *
 * @see kvstore.spring.boot.KvStoreProperties
 * @see kvstore.spring.boot.TimeoutHandlerRegistrar
 */
package kvstore.spring.boot;
