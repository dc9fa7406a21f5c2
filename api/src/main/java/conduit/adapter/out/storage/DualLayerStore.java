package conduit.adapter.out.storage;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import conduit.adapter.out.storage.memory.MemoryStore;
import conduit.core.model.storage.StoreEntry;
import conduit.core.port.out.KeyValueStore;

/**
 * Cache-aside composition of a {@link MemoryStore} and a durable store.
 *
 * <p>Reads check memory first. On a miss the durable layer is queried and, on a hit, memory
 * is repopulated with the record's remaining lifetime so the memory copy never outlives the
 * TTL passed to {@link #set}. Durable backends that do not report expiry are served without
 * repopulating memory.
 *
 * <p>Writes and deletes go to the durable layer first; a durable failure fails the operation.
 * Without a durable layer this store behaves like its memory layer.
 *
 * @param <T> the value type
 */
public class DualLayerStore<T> implements KeyValueStore<T> {

    private static final Logger LOG = Logger.getLogger(DualLayerStore.class);

    private final MemoryStore<T> memory;
    private final KeyValueStore<T> persistent;

    /**
     * @param memory the memory layer
     * @param persistent the durable layer, or null for memory only
     */
    public DualLayerStore(MemoryStore<T> memory, KeyValueStore<T> persistent) {
        if (memory == null) {
            throw new IllegalArgumentException("memory layer cannot be null");
        }
        this.memory = memory;
        this.persistent = persistent;
    }

    public MemoryStore<T> memoryLayer() {
        return memory;
    }

    public Optional<KeyValueStore<T>> persistentLayer() {
        return Optional.ofNullable(persistent);
    }

    @Override
    public boolean tracksExpiry() {
        return persistent == null || persistent.tracksExpiry();
    }

    @Override
    public Uni<Optional<T>> get(String key) {
        return memory.get(key).flatMap(cached -> {
            if (cached.isPresent() || persistent == null) {
                return Uni.createFrom().item(cached);
            }
            if (!persistent.tracksExpiry()) {
                return persistent.get(key);
            }
            return persistent
                    .getEntry(key)
                    .flatMap(entry -> repopulate(key, entry))
                    .map(entry -> entry.map(StoreEntry::value));
        });
    }

    @Override
    public Uni<Optional<StoreEntry<T>>> getEntry(String key) {
        return memory.getEntry(key).flatMap(cached -> {
            if (cached.isPresent() || persistent == null) {
                return Uni.createFrom().item(cached);
            }
            return persistent.getEntry(key).flatMap(entry -> repopulate(key, entry));
        });
    }

    @Override
    public Uni<Void> set(String key, T value, Duration ttl) {
        if (persistent == null) {
            return memory.set(key, value, ttl);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return Uni.createFrom().failure(new IllegalArgumentException("ttl must be positive"));
        }
        // The deadline is fixed before the durable write so the memory copy never outlives it.
        final var entry = new StoreEntry<>(value, memory.clock().instant().plus(ttl));
        return persistent.set(key, value, ttl).flatMap(v -> memory.put(key, entry));
    }

    /**
     * Delete from both layers.
     *
     * @return true if either layer held a live record; fails if the durable delete fails
     */
    @Override
    public Uni<Boolean> delete(String key) {
        if (persistent == null) {
            return memory.delete(key);
        }
        return persistent.delete(key)
                .flatMap(persisted -> memory.delete(key).map(cached -> persisted || cached));
    }

    @Override
    public Uni<Optional<T>> consume(String key) {
        if (persistent == null) {
            return memory.consume(key);
        }
        // The durable consume decides the winner; the memory copy is dropped either way
        return persistent.consume(key).flatMap(value -> memory.delete(key).replaceWith(value));
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return memory.exists(key).flatMap(cached -> {
            if (cached || persistent == null) {
                return Uni.createFrom().item(cached);
            }
            return persistent.exists(key);
        });
    }

    @Override
    public Uni<Void> connect() {
        if (persistent == null) {
            return memory.connect();
        }
        return memory.connect().flatMap(v -> persistent.connect());
    }

    @Override
    public Uni<Boolean> healthCheck() {
        if (persistent == null) {
            return memory.healthCheck();
        }
        return memory.healthCheck()
                .flatMap(memoryHealthy -> persistent
                        .healthCheck()
                        .map(persistentHealthy -> memoryHealthy && persistentHealthy))
                .onFailure()
                .recoverWithItem(false);
    }

    @Override
    public Uni<Void> close() {
        if (persistent == null) {
            return memory.close();
        }
        return memory.close().flatMap(v -> persistent.close());
    }

    private Uni<Optional<StoreEntry<T>>> repopulate(String key, Optional<StoreEntry<T>> entry) {
        if (entry.isEmpty()) {
            return Uni.createFrom().item(entry);
        }
        LOG.debug("Repopulating memory layer from persistent store");
        return memory.put(key, entry.get()).replaceWith(entry);
    }
}
