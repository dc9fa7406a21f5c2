package conduit.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import conduit.core.model.storage.StoreEntry;

/**
 * Asynchronous key-value store with per-entry TTL.
 *
 * <p>Implementations must never return a record whose TTL has elapsed, even if the
 * backend has not evicted it yet.
 *
 * <p>Built-in implementations:
 * <ul>
 *   <li>{@code MemoryStore} - process-local, Caffeine backed</li>
 *   <li>{@code RedisStore} - durable, optionally encrypted at rest</li>
 *   <li>{@code DualLayerStore} - memory in front of a durable store</li>
 * </ul>
 *
 * <p>Operator-supplied backends are registered through {@link conduit.spi.KeyValueStoreProvider}.
 *
 * @param <T> the value type
 */
public interface KeyValueStore<T> {

    /**
     * Read a live value.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    Uni<Optional<T>> get(String key);

    /**
     * Insert or replace a value. The TTL is reset.
     *
     * @param key the key
     * @param value the value
     * @param ttl time to live, must be positive
     * @return Uni completing when the write is durable in every layer
     */
    Uni<Void> set(String key, T value, Duration ttl);

    /**
     * Remove a value.
     *
     * @param key the key
     * @return true if a record existed
     */
    Uni<Boolean> delete(String key);

    /**
     * Check whether a live value exists.
     */
    Uni<Boolean> exists(String key);

    /**
     * Open backend connections. Idempotent.
     */
    Uni<Void> connect();

    /**
     * Probe the backend. Never fails; any error is reported as {@code false}.
     */
    Uni<Boolean> healthCheck();

    /**
     * Release backend resources.
     */
    Uni<Void> close();

    /**
     * Whether {@link #getEntry} reports expiry for live records.
     */
    default boolean tracksExpiry() {
        return false;
    }

    /**
     * Read a live value together with its expiry.
     *
     * <p>Backends that do not track expiry return {@link Optional#empty()} for every key; the
     * dual-layer store then falls back to {@link #get}.
     *
     * @param key the key
     * @return the entry, or empty if absent, expired, or unsupported
     */
    default Uni<Optional<StoreEntry<T>>> getEntry(String key) {
        return Uni.createFrom().item(Optional.empty());
    }

    /**
     * Atomically read and remove a value.
     *
     * <p>The default reads then deletes; only the caller whose delete removed the record
     * receives the value, so concurrent callers never both succeed.
     *
     * @param key the key
     * @return the value, or empty if absent, expired, or consumed by another caller
     */
    default Uni<Optional<T>> consume(String key) {
        return get(key).flatMap(value -> {
            if (value.isEmpty()) {
                return Uni.createFrom().item(Optional.<T>empty());
            }
            return delete(key).map(removed -> removed ? value : Optional.<T>empty());
        });
    }
}
