package kvstore.spi;

/**
 * Observability hook for exporting timeout scheduler counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of timeouts persisted and armed via {@code addTimeout}.
     */
    void incrementTimeoutScheduled();

    /**
     * Increments the count of timeouts whose action completed without error.
     */
    void incrementTimeoutFired();

    /**
     * Increments the count of timeouts that expired with no registered descriptor.
     */
    void incrementTimeoutDropped();

    /**
     * Increments the count of timeouts whose action threw.
     */
    void incrementTimeoutFailed();

    /**
     * Increments the count of timeouts cancelled via {@code removeTimeout}.
     */
    default void incrementTimeoutCancelled() {
    }

    /**
     * Increments the count of durable records re-armed after a restart.
     */
    default void incrementTimeoutRecovered() {
    }

    /**
     * Records the number of timers currently armed in memory.
     *
     * @param armed number of armed timers
     */
    void recordArmedTimers(int armed);

    /**
     * Records the time spent executing a timeout action.
     *
     * @param durationMs action execution time in milliseconds (always non-negative)
     */
    default void recordActionDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementTimeoutScheduled() {
        }

        @Override
        public void incrementTimeoutFired() {
        }

        @Override
        public void incrementTimeoutDropped() {
        }

        @Override
        public void incrementTimeoutFailed() {
        }

        @Override
        public void recordArmedTimers(int armed) {
        }
    }
}
