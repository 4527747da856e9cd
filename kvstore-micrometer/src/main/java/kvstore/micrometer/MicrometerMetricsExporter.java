package kvstore.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import kvstore.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code kvstore.timeout.scheduled}: timeouts persisted and armed</li>
 *   <li>{@code kvstore.timeout.fired}: actions completed</li>
 *   <li>{@code kvstore.timeout.failed}: actions that threw</li>
 *   <li>{@code kvstore.timeout.dropped}: expired with no registered descriptor</li>
 *   <li>{@code kvstore.timeout.cancelled}: removed before expiry</li>
 *   <li>{@code kvstore.timeout.recovered}: re-armed from the store after a restart</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code kvstore.timeout.armed}: timers currently armed in memory</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code kvstore.timeout.action.duration.ms}: action execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter scheduled;
    private final Counter fired;
    private final Counter failed;
    private final Counter dropped;
    private final Counter cancelled;
    private final Counter recovered;
    private final Gauge armedGauge;
    private final DistributionSummary actionDuration;

    private final AtomicInteger armed = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "kvstore"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "kvstore");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "chat.kvstore"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        String base = namePrefix + ".timeout";
        this.scheduled = Counter.builder(base + ".scheduled")
                .description("Timeouts persisted and armed")
                .register(registry);
        this.fired = Counter.builder(base + ".fired")
                .description("Timeout actions completed")
                .register(registry);
        this.failed = Counter.builder(base + ".failed")
                .description("Timeout actions that threw")
                .register(registry);
        this.dropped = Counter.builder(base + ".dropped")
                .description("Timeouts expired with no registered descriptor")
                .register(registry);
        this.cancelled = Counter.builder(base + ".cancelled")
                .description("Timeouts removed before expiry")
                .register(registry);
        this.recovered = Counter.builder(base + ".recovered")
                .description("Timeouts re-armed from the store on startup")
                .register(registry);

        this.armedGauge = Gauge.builder(base + ".armed", armed, AtomicInteger::get)
                .description("Timers currently armed in memory")
                .register(registry);

        this.actionDuration = DistributionSummary.builder(base + ".action.duration.ms")
                .description("Timeout action execution time in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementTimeoutScheduled() {
        if (closed) return;
        scheduled.increment();
    }

    @Override
    public void incrementTimeoutFired() {
        if (closed) return;
        fired.increment();
    }

    @Override
    public void incrementTimeoutDropped() {
        if (closed) return;
        dropped.increment();
    }

    @Override
    public void incrementTimeoutFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void incrementTimeoutCancelled() {
        if (closed) return;
        cancelled.increment();
    }

    @Override
    public void incrementTimeoutRecovered() {
        if (closed) return;
        recovered.increment();
    }

    @Override
    public void recordArmedTimers(int armed) {
        if (closed) return;
        this.armed.set(armed);
    }

    @Override
    public void recordActionDurationMs(long durationMs) {
        if (closed) return;
        actionDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this once the {@link kvstore.timeout.TimeoutManager} using it is closed.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(scheduled, fired, failed, dropped, cancelled, recovered,
                armedGauge, actionDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
