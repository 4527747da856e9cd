package kvstore.timeout;

import com.fasterxml.jackson.databind.JsonNode;
import kvstore.Entry;
import kvstore.KeyValueStore;
import kvstore.StoreListener;
import kvstore.Subscription;
import kvstore.TableNames;
import kvstore.spi.MetricsExporter;
import kvstore.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable deferred-action scheduler on top of a {@link KeyValueStore}.
 *
 * <p>{@link #addTimeout} writes a {@link TimeoutRecord} to the reserved
 * {@value TableNames#TIMEOUT_TABLE} table, then arms an in-memory timer. When the timer
 * expires the record is handed to the {@link TimeoutAction} registered under its id and
 * the durable record is deleted. Records that outlive the process are re-armed by
 * {@link #start()} once the store is ready; records already overdue fire immediately.
 *
 * <p>Actions run one at a time on a single daemon thread. An action that throws is logged
 * and not retried. A record whose id has no registered action when it expires is logged
 * and dropped permanently, so register actions before connecting the store.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * TimeoutManager timeouts = TimeoutManager.builder().store(store).build();
 * timeouts.registerTimeout("reminder", record -> send(record.outData()));
 * timeouts.start();
 * store.connect();
 * String key = timeouts.addTimeout("reminder", Duration.ofMinutes(5), payload);
 * }</pre>
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 *
 * @see TimeoutManager.Builder
 */
public final class TimeoutManager implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(TimeoutManager.class.getName());
    private static final String TABLE = TableNames.TIMEOUT_TABLE;

    private final KeyValueStore store;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final TimeoutRegistry registry = new TimeoutRegistry();
    private final CopyOnWriteArrayList<TimeoutListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean recovered = new AtomicBoolean();

    private ScheduledExecutorService scheduler;
    private Subscription storeSubscription;
    private volatile boolean started;
    private volatile boolean closed;

    private TimeoutManager(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        if (!store.hasTable(TABLE)) {
            throw new IllegalArgumentException("store does not declare the " + TABLE + " table");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers the action run when timeouts with this id expire.
     *
     * @return this manager for chaining
     * @throws DuplicateTimeoutException if the id is already registered
     * @throws IllegalArgumentException if the id is blank
     */
    public TimeoutManager registerTimeout(String id, TimeoutAction action) {
        registry.register(new TimeoutDescriptor(id, action));
        logger.log(Level.FINE, "Registered timeout {0}", id);
        return this;
    }

    public Optional<TimeoutDescriptor> descriptor(String id) {
        return registry.descriptor(id);
    }

    public Set<String> registeredIds() {
        return registry.descriptorIds();
    }

    /**
     * Subscribes the manager to the store and re-arms persisted timeouts once the store is
     * ready (immediately if it already is). Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("TimeoutManager has been closed");
        }
        if (started) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("kvstore-timeout-"));
        storeSubscription = store.subscribe(new StoreListener() {
            @Override
            public void onReady(KeyValueStore readyStore) {
                recover();
            }
        });
        started = true;
        if (store.isReady()) {
            recover();
        }
    }

    /**
     * Persists a timeout and arms its timer.
     *
     * @param id      descriptor id to dispatch to
     * @param timeMs  delay in milliseconds
     * @param outData payload handed to the action, may be {@code null}
     * @return the durable key {@code <id>_<datestamp>}
     * @throws IllegalArgumentException if {@code timeMs} is negative
     * @throws IllegalStateException if the manager is not started or has been closed
     */
    public String addTimeout(String id, long timeMs, JsonNode outData) {
        Objects.requireNonNull(id, "id");
        if (timeMs < 0) {
            throw new IllegalArgumentException("time must be >= 0");
        }
        ensureRunning();
        TimeoutRecord record = new TimeoutRecord(id, timeMs, clock.millis(), outData);
        String key = record.key();
        store.set(TABLE, key, record.toJson());
        registry.arm(key, () -> schedule(key, record, timeMs));
        metrics.incrementTimeoutScheduled();
        metrics.recordArmedTimers(registry.armedCount());
        logger.log(Level.FINE, "Scheduled timeout {0} in {1} ms", new Object[]{key, timeMs});
        for (TimeoutListener listener : listeners) {
            try {
                listener.onScheduled(record);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Timeout listener failed on scheduled " + key, e);
            }
        }
        return key;
    }

    public String addTimeout(String id, Duration delay, JsonNode outData) {
        Objects.requireNonNull(delay, "delay");
        return addTimeout(id, delay.toMillis(), outData);
    }

    /**
     * Cancels an armed timeout and deletes its durable record.
     *
     * @return {@code false} if no timer is armed under {@code key}
     */
    public boolean removeTimeout(String key) {
        ScheduledFuture<?> timer = registry.disarm(key);
        if (timer == null) {
            return false;
        }
        timer.cancel(false);
        store.delete(TABLE, key);
        metrics.incrementTimeoutCancelled();
        metrics.recordArmedTimers(registry.armedCount());
        logger.log(Level.FINE, "Cancelled timeout {0}", key);
        return true;
    }

    public boolean hasTimeout(String key) {
        return registry.isArmed(key);
    }

    /**
     * Returns the timeouts currently persisted in the store. Malformed records are skipped.
     */
    public List<TimeoutRecord> activeTimeouts() {
        List<TimeoutRecord> records = new ArrayList<>();
        for (JsonNode value : store.all(TABLE).values()) {
            try {
                records.add(TimeoutRecord.fromJson(value));
            } catch (IllegalArgumentException e) {
                logger.log(Level.FINE, "Ignoring malformed timeout record: {0}", e.getMessage());
            }
        }
        return records;
    }

    public List<String> armedKeys() {
        return registry.armedKeys();
    }

    public Subscription subscribe(TimeoutListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    void recover() {
        if (closed || !recovered.compareAndSet(false, true)) {
            return;
        }
        long now = clock.millis();
        int rearmed = 0;
        for (Entry entry : store.findMany(TABLE, e -> true)) {
            TimeoutRecord record;
            try {
                record = TimeoutRecord.fromJson(entry.value());
            } catch (IllegalArgumentException e) {
                logger.log(Level.WARNING, "Skipping malformed timeout record {0}: {1}",
                        new Object[]{entry.key(), e.getMessage()});
                continue;
            }
            String key = entry.key();
            long remaining = Math.max(0L, record.dueAt() - now);
            if (registry.armIfAbsent(key, () -> schedule(key, record, remaining))) {
                metrics.incrementTimeoutRecovered();
                rearmed++;
            }
        }
        metrics.recordArmedTimers(registry.armedCount());
        logger.log(Level.INFO, "Recovered {0} persisted timeouts", rearmed);
    }

    private ScheduledFuture<?> schedule(String key, TimeoutRecord record, long delayMs) {
        return scheduler.schedule(() -> fire(key, record), delayMs, TimeUnit.MILLISECONDS);
    }

    private void fire(String key, TimeoutRecord record) {
        if (registry.disarm(key) == null) {
            return; // cancelled or replaced while waiting for the lock
        }
        try {
            metrics.recordArmedTimers(registry.armedCount());
            for (TimeoutListener listener : listeners) {
                try {
                    listener.onFired(record);
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Timeout listener failed on fired " + key, e);
                }
            }
            Optional<TimeoutDescriptor> descriptor = registry.descriptor(record.id());
            if (descriptor.isEmpty()) {
                logger.log(Level.WARNING, "No timeout registered for id {0}; dropping {1}",
                        new Object[]{record.id(), key});
                metrics.incrementTimeoutDropped();
            } else {
                run(key, descriptor.get(), record);
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Timeout dispatch failed for " + key, t);
        } finally {
            deleteRecord(key);
        }
    }

    private void run(String key, TimeoutDescriptor descriptor, TimeoutRecord record) {
        long start = System.nanoTime();
        try {
            descriptor.action().execute(record);
            metrics.incrementTimeoutFired();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Timeout action failed for " + key, e);
            metrics.incrementTimeoutFailed();
        } finally {
            metrics.recordActionDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }
    }

    private void deleteRecord(String key) {
        try {
            store.delete(TABLE, key);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to delete fired timeout record " + key, e);
        }
    }

    private void ensureRunning() {
        if (closed) {
            throw new IllegalStateException("TimeoutManager has been closed");
        }
        if (!started) {
            throw new IllegalStateException("TimeoutManager has not been started");
        }
    }

    /**
     * Cancels all armed timers and stops the scheduler thread. Durable records are kept
     * and re-armed by the next manager started on the same store.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        int cancelled = registry.cancelAll();
        if (storeSubscription != null) {
            storeSubscription.close();
            storeSubscription = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        metrics.recordArmedTimers(0);
        logger.log(Level.FINE, "TimeoutManager closed, {0} timers cancelled", cancelled);
    }

    /**
     * Builder for {@link TimeoutManager}.
     */
    public static final class Builder {
        private KeyValueStore store;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        public Builder store(KeyValueStore store) {
            this.store = store;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Clock used for datestamps and recovery; defaults to the UTC system clock. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TimeoutManager build() {
            return new TimeoutManager(this);
        }
    }
}
