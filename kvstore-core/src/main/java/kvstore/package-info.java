/**
 * Storage contract shared by every backend.
 *
 * <p>A {@link kvstore.KeyValueStore} is partitioned into tables fixed at build time, stores
 * JSON values under string keys and reports every effective change as a
 * {@link kvstore.ChangeEvent} to its {@linkplain kvstore.StoreListener listeners}. Writes whose
 * new value is deep-equal to the stored one are suppressed.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>kvstore-core</b> - this contract, the {@linkplain kvstore.file file backend} and the
 *       {@linkplain kvstore.timeout timeout scheduler}</li>
 *   <li><b>kvstore-jdbc</b> - relational backend (H2, MySQL, PostgreSQL)</li>
 *   <li><b>kvstore-mongo</b> - MongoDB backend</li>
 *   <li><b>kvstore-firestore</b> - Google Cloud Firestore backend</li>
 *   <li><b>kvstore-micrometer</b> - Micrometer metrics for the scheduler</li>
 *   <li><b>kvstore-spring-boot-starter</b> - Spring Boot auto-configuration</li>
 * </ul>
 *
 * @see kvstore.KeyValueStore
 * @see kvstore.timeout.TimeoutManager
 */
package kvstore;
