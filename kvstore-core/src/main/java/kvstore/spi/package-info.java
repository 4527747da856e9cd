/**
 * Extension points: {@link kvstore.spi.MetricsExporter}.
 */
package kvstore.spi;
