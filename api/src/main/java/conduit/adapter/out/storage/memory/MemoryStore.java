package conduit.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import conduit.core.model.storage.StoreEntry;
import conduit.core.port.out.KeyValueStore;

/**
 * Process-local key-value store backed by Caffeine.
 *
 * <p>Each entry expires after the TTL passed to {@link #set}. Caffeine evicts entries in the
 * background; every read also re-checks the entry's expiry against the store clock so an
 * entry is never served past its TTL.
 *
 * <p>Records are lost on restart and are not shared across instances.
 *
 * @param <T> the value type
 */
public class MemoryStore<T> implements KeyValueStore<T> {

    private static final Logger LOG = Logger.getLogger(MemoryStore.class);
    private static final long DEFAULT_MAX_SIZE = 100_000;

    private final String name;
    private final Clock clock;
    private final Cache<String, StoreEntry<T>> cache;

    public MemoryStore(String name) {
        this(name, Clock.systemUTC(), DEFAULT_MAX_SIZE);
    }

    public MemoryStore(String name, Clock clock) {
        this(name, clock, DEFAULT_MAX_SIZE);
    }

    public MemoryStore(String name, Clock clock, long maxSize) {
        this.name = name;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfter(new EntryExpiry())
                .maximumSize(maxSize)
                .build();
    }

    /**
     * Expiry policy that honours each entry's own deadline.
     */
    private class EntryExpiry implements Expiry<String, StoreEntry<T>> {
        @Override
        public long expireAfterCreate(String key, StoreEntry<T> entry, long currentTime) {
            return entry.remaining(clock.instant()).toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, StoreEntry<T> entry, long currentTime, long currentDuration) {
            return entry.remaining(clock.instant()).toNanos();
        }

        @Override
        public long expireAfterRead(String key, StoreEntry<T> entry, long currentTime, long currentDuration) {
            return currentDuration; // Reads never extend the TTL
        }
    }

    @Override
    public Uni<Optional<T>> get(String key) {
        return getEntry(key).map(entry -> entry.map(StoreEntry::value));
    }

    @Override
    public boolean tracksExpiry() {
        return true;
    }

    @Override
    public Uni<Optional<StoreEntry<T>>> getEntry(String key) {
        return Uni.createFrom().item(() -> live(key, cache.getIfPresent(key)));
    }

    @Override
    public Uni<Void> set(String key, T value, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return Uni.createFrom().failure(new IllegalArgumentException("ttl must be positive"));
        }
        return Uni.createFrom().item(() -> {
            cache.put(key, new StoreEntry<>(value, clock.instant().plus(ttl)));
            LOG.debugf("Stored %s entry with TTL %s", name, ttl);
            return null;
        });
    }

    /**
     * Store an entry with an absolute expiry. Used to repopulate this store from a
     * persistent layer without extending the record's lifetime.
     *
     * @param key the key
     * @param entry the entry and its expiry
     * @return Uni completing when stored; expired entries are dropped
     */
    public Uni<Void> put(String key, StoreEntry<T> entry) {
        return Uni.createFrom().item(() -> {
            if (!entry.isExpiredAt(clock.instant())) {
                cache.put(key, entry);
            }
            return null;
        });
    }

    public Clock clock() {
        return clock;
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> {
            final var removed = cache.asMap().remove(key);
            return removed != null && !removed.isExpiredAt(clock.instant());
        });
    }

    @Override
    public Uni<Optional<T>> consume(String key) {
        // ConcurrentMap.remove is atomic: exactly one caller receives the entry
        return Uni.createFrom().item(() -> live(key, cache.asMap().remove(key)).map(StoreEntry::value));
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return getEntry(key).map(Optional::isPresent);
    }

    @Override
    public Uni<Void> connect() {
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Boolean> healthCheck() {
        return Uni.createFrom().item(Boolean.TRUE);
    }

    @Override
    public Uni<Void> close() {
        return Uni.createFrom().item(() -> {
            cache.invalidateAll();
            cache.cleanUp();
            return null;
        });
    }

    /**
     * Number of entries currently held, including ones awaiting eviction (for testing).
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private Optional<StoreEntry<T>> live(String key, StoreEntry<T> entry) {
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            cache.asMap().remove(key, entry);
            LOG.debugf("Dropped expired %s entry", name);
            return Optional.empty();
        }
        return Optional.of(entry);
    }
}
