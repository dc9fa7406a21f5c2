package conduit.adapter.out.storage;

import java.lang.reflect.Method;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import conduit.adapter.out.storage.memory.MemoryStore;
import conduit.adapter.out.storage.redis.RedisStore;
import conduit.adapter.out.storage.redis.StoreCipher;
import conduit.core.model.storage.StoreSettings;
import conduit.core.port.out.KeyValueStore;
import conduit.core.port.out.Metrics;
import conduit.spi.KeyValueStoreProvider;
import conduit.spi.StorageProviderException;

/**
 * Builds key-value stores from {@link StoreSettings}.
 *
 * <p>Persistent and custom stores are connected and health-checked before they are returned;
 * a store that fails either check is reported as {@link StorageProviderException} so that
 * startup fails fast instead of serving requests against an unreachable backend.
 *
 * <ul>
 *   <li>{@code memory} - a new {@link MemoryStore}</li>
 *   <li>{@code persistent} - a {@link RedisStore}, fronted by a memory layer when enabled</li>
 *   <li>{@code custom} - a store from the named {@link KeyValueStoreProvider}, fronted by a
 *       memory layer when enabled</li>
 * </ul>
 */
public class StoreFactory {

    private static final Logger LOG = Logger.getLogger(StoreFactory.class);

    static final Set<String> REQUIRED_METHODS =
            Set.of("get", "set", "delete", "exists", "connect", "healthCheck", "close");

    private final Supplier<ReactiveRedisDataSource> redisDataSource;
    private final ObjectMapper objectMapper;
    private final Map<String, KeyValueStoreProvider> providers;
    private final Metrics metrics;
    private final Clock clock;

    public StoreFactory(
            Supplier<ReactiveRedisDataSource> redisDataSource,
            ObjectMapper objectMapper,
            Iterable<KeyValueStoreProvider> providers,
            Metrics metrics,
            Clock clock) {
        this.redisDataSource = redisDataSource;
        this.objectMapper = objectMapper;
        this.providers = indexByName(providers);
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Create a store and verify it is usable.
     *
     * @param storeName logical store name, for logging and metrics
     * @param valueType value type, used for serialization
     * @param settings store settings
     * @param <T> the value type
     * @return the ready store; fails with {@link StorageProviderException}
     */
    public <T> Uni<KeyValueStore<T>> create(String storeName, Class<T> valueType, StoreSettings settings) {
        return switch (settings.type()) {
            case MEMORY -> Uni.createFrom().item(new MemoryStore<T>(storeName, clock));
            case PERSISTENT -> Uni.createFrom()
                    .item(() -> createRedisStore(storeName, valueType, settings))
                    .flatMap(store -> verified(storeName, store))
                    .map(store -> layered(storeName, store, settings));
            case CUSTOM -> Uni.createFrom()
                    .item(() -> createCustomStore(storeName, valueType, settings))
                    .flatMap(store -> verified(storeName, store))
                    .map(store -> layered(storeName, store, settings));
        };
    }

    private <T> KeyValueStore<T> createRedisStore(String storeName, Class<T> valueType, StoreSettings settings) {
        final ReactiveRedisDataSource dataSource;
        try {
            dataSource = redisDataSource.get();
        } catch (RuntimeException e) {
            throw new StorageProviderException("Redis client is not available for store " + storeName, e);
        }
        return new RedisStore<>(
                storeName,
                dataSource,
                objectMapper,
                valueType,
                settings.keyPrefix(),
                settings.operationTimeout(),
                new StoreCipher(settings.encryptionKey()),
                metrics,
                clock);
    }

    private <T> KeyValueStore<T> createCustomStore(String storeName, Class<T> valueType, StoreSettings settings) {
        final var providerName = settings.provider().orElseThrow();
        final var provider = providers.get(providerName);
        if (provider == null) {
            throw new StorageProviderException("Unknown key-value store provider '%s'. Available: %s"
                    .formatted(providerName, providers.keySet().stream().sorted().toList()));
        }

        LOG.infof("Creating %s store with provider: %s", storeName, provider.description());
        final Object candidate;
        try {
            candidate = provider.createStore(storeName, valueType, settings);
        } catch (RuntimeException e) {
            throw new StorageProviderException(
                    "Provider '%s' failed to create store %s".formatted(providerName, storeName), e);
        }
        return requireStoreContract(providerName, candidate);
    }

    /**
     * Check that a provider result implements the full store contract.
     *
     * @throws StorageProviderException naming every missing operation
     */
    @SuppressWarnings("unchecked")
    static <T> KeyValueStore<T> requireStoreContract(String providerName, Object candidate) {
        if (candidate == null) {
            throw new StorageProviderException("Provider '%s' returned no store".formatted(providerName));
        }
        if (candidate instanceof KeyValueStore<?> store) {
            return (KeyValueStore<T>) store;
        }
        final var present = Arrays.stream(candidate.getClass().getMethods())
                .map(Method::getName)
                .collect(Collectors.toSet());
        final List<String> missing = REQUIRED_METHODS.stream()
                .filter(method -> !present.contains(method))
                .sorted()
                .toList();
        throw new StorageProviderException("Provider '%s' returned %s, which is not a KeyValueStore (missing: %s)"
                .formatted(providerName, candidate.getClass().getName(), missing.isEmpty() ? "interface" : missing));
    }

    private <T> Uni<KeyValueStore<T>> verified(String storeName, KeyValueStore<T> store) {
        return store.connect()
                .onFailure()
                .transform(error -> new StorageProviderException(
                        "Failed to connect %s store: %s".formatted(storeName, error.getMessage()), error))
                .flatMap(v -> store.healthCheck())
                .map(healthy -> {
                    if (!Boolean.TRUE.equals(healthy)) {
                        throw new StorageProviderException("Health check failed for %s store".formatted(storeName));
                    }
                    return store;
                });
    }

    private <T> KeyValueStore<T> layered(String storeName, KeyValueStore<T> store, StoreSettings settings) {
        if (!settings.cacheInMemory()) {
            return store;
        }
        return new DualLayerStore<>(new MemoryStore<>(storeName, clock), store);
    }

    private static Map<String, KeyValueStoreProvider> indexByName(Iterable<KeyValueStoreProvider> providers) {
        final var list = new ArrayList<KeyValueStoreProvider>();
        if (providers != null) {
            providers.forEach(list::add);
        }
        return list.stream().collect(Collectors.toMap(KeyValueStoreProvider::name, Function.identity(), (a, b) -> {
            LOG.warnf("Duplicate key-value store provider name '%s', using %s", a.name(), a.getClass().getName());
            return a;
        }));
    }
}
