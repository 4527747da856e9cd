package kvstore.timeout;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Descriptors by id and armed timers by durable key, owned by one {@link TimeoutManager}.
 *
 * <p>Arming, disarming and cancel-all are serialized on one lock, so a timer is either
 * fired or cancelled, never both.
 */
final class TimeoutRegistry {
    private final Map<String, TimeoutDescriptor> descriptors = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> armed = new HashMap<>();
    private final Object lock = new Object();

    void register(TimeoutDescriptor descriptor) {
        if (descriptors.putIfAbsent(descriptor.id(), descriptor) != null) {
            throw new DuplicateTimeoutException(descriptor.id());
        }
    }

    Optional<TimeoutDescriptor> descriptor(String id) {
        return Optional.ofNullable(descriptors.get(id));
    }

    Set<String> descriptorIds() {
        return Set.copyOf(descriptors.keySet());
    }

    /**
     * Arms a timer under {@code key}, cancelling any timer already armed there.
     */
    void arm(String key, Supplier<ScheduledFuture<?>> timer) {
        synchronized (lock) {
            ScheduledFuture<?> previous = armed.put(key, timer.get());
            if (previous != null) {
                previous.cancel(false);
            }
        }
    }

    /**
     * Arms a timer unless one is already armed under {@code key}.
     *
     * @return {@code true} if a timer was armed
     */
    boolean armIfAbsent(String key, Supplier<ScheduledFuture<?>> timer) {
        synchronized (lock) {
            if (armed.containsKey(key)) {
                return false;
            }
            armed.put(key, timer.get());
            return true;
        }
    }

    /**
     * Removes the timer armed under {@code key} without cancelling it.
     *
     * @return the removed timer, or {@code null} if none was armed
     */
    ScheduledFuture<?> disarm(String key) {
        synchronized (lock) {
            return armed.remove(key);
        }
    }

    boolean isArmed(String key) {
        synchronized (lock) {
            return armed.containsKey(key);
        }
    }

    int armedCount() {
        synchronized (lock) {
            return armed.size();
        }
    }

    List<String> armedKeys() {
        synchronized (lock) {
            return new ArrayList<>(armed.keySet());
        }
    }

    /**
     * Cancels and forgets every armed timer.
     *
     * @return the number of timers cancelled
     */
    int cancelAll() {
        synchronized (lock) {
            int count = armed.size();
            for (ScheduledFuture<?> timer : armed.values()) {
                timer.cancel(false);
            }
            armed.clear();
            return count;
        }
    }
}
