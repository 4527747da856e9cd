package kvstore.timeout;

import java.util.Objects;

/**
 * In-memory binding of a timeout id to its action. Never persisted.
 */
public record TimeoutDescriptor(String id, TimeoutAction action) {

    public TimeoutDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(action, "action");
        if (id.isBlank()) {
            throw new IllegalArgumentException("timeout id must not be blank");
        }
    }
}
