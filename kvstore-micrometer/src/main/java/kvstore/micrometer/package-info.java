/**
 * Micrometer bridge for exporting timeout scheduler metrics.
 *
 * <p>{@link kvstore.micrometer.MicrometerMetricsExporter} implements the
 * {@link kvstore.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 */
package kvstore.micrometer;
