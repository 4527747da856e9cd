/**
 * Durable timeouts: records persisted in the {@code timeout} table, armed in memory and
 * re-armed after a restart.
 */
package kvstore.timeout;
