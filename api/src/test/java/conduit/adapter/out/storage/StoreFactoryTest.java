package conduit.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import conduit.MutableClock;
import conduit.adapter.out.storage.memory.MemoryStore;
import conduit.core.model.storage.StoreSettings;
import conduit.core.model.storage.StoreType;
import conduit.core.port.out.KeyValueStore;
import conduit.core.port.out.Metrics;
import conduit.spi.KeyValueStoreProvider;
import conduit.spi.StorageProviderException;

@DisplayName("StoreFactory")
@ExtendWith(MockitoExtension.class)
class StoreFactoryTest {

    @Mock
    private Metrics metrics;

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
    }

    private StoreFactory factory(List<KeyValueStoreProvider> providers) {
        return new StoreFactory(
                () -> {
                    throw new IllegalStateException("Redis client not configured");
                },
                new ObjectMapper(),
                providers,
                metrics,
                clock);
    }

    private static StoreSettings custom(String provider, boolean cacheInMemory) {
        return new StoreSettings(
                StoreType.CUSTOM, Optional.of(provider), "test:", cacheInMemory, Duration.ofSeconds(1), Optional.empty());
    }

    @Nested
    @DisplayName("memory")
    class MemoryTests {

        @Test
        @DisplayName("should create a memory store")
        void shouldCreateMemoryStore() {
            final var store = factory(List.of())
                    .create("session", String.class, StoreSettings.memory("test:"))
                    .await()
                    .indefinitely();

            assertInstanceOf(MemoryStore.class, store);
        }
    }

    @Nested
    @DisplayName("persistent")
    class PersistentTests {

        @Test
        @DisplayName("should fail when no Redis client is available")
        void shouldFailWithoutRedisClient() {
            final var settings = new StoreSettings(
                    StoreType.PERSISTENT, Optional.empty(), "test:", true, Duration.ofSeconds(1), Optional.empty());

            final var error = assertThrows(
                    StorageProviderException.class,
                    () -> factory(List.of()).create("session", String.class, settings).await().indefinitely());

            assertTrue(error.getMessage().contains("session"));
        }

        @Test
        @DisplayName("should fail when Redis is unreachable")
        void shouldFailWhenRedisUnreachable(@Mock ReactiveRedisDataSource dataSource) {
            when(dataSource.execute("PING"))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("Connection refused")));
            final var redisFactory = new StoreFactory(() -> dataSource, new ObjectMapper(), List.of(), metrics, clock);
            final var settings = new StoreSettings(
                    StoreType.PERSISTENT, Optional.empty(), "test:", true, Duration.ofSeconds(1), Optional.empty());

            final var error = assertThrows(
                    StorageProviderException.class,
                    () -> redisFactory.create("session", String.class, settings).await().indefinitely());

            assertTrue(error.getMessage().startsWith("Failed to connect session store"));
        }
    }

    @Nested
    @DisplayName("custom")
    class CustomTests {

        @Test
        @DisplayName("should name the available providers when the provider is unknown")
        void shouldNameAvailableProviders() {
            final var error = assertThrows(
                    StorageProviderException.class,
                    () -> factory(List.of(new FixedProvider("dynamodb", new MemoryStore<>("x"))))
                            .create("session", String.class, custom("etcd", false))
                            .await()
                            .indefinitely());

            assertTrue(error.getMessage().contains("etcd"));
            assertTrue(error.getMessage().contains("[dynamodb]"));
        }

        @Test
        @DisplayName("should use the provider's store directly without memory cache")
        void shouldUseProviderStore() {
            final var backing = new MemoryStore<String>("backing", clock);

            final var store = factory(List.of(new FixedProvider("dynamodb", backing)))
                    .create("session", String.class, custom("dynamodb", false))
                    .await()
                    .indefinitely();

            assertSame(backing, store);
        }

        @Test
        @DisplayName("should front the provider's store with a memory layer")
        void shouldFrontWithMemoryLayer() {
            final var backing = new MemoryStore<String>("backing", clock);

            final var store = factory(List.of(new FixedProvider("dynamodb", backing)))
                    .create("session", String.class, custom("dynamodb", true))
                    .await()
                    .indefinitely();

            final var layered = assertInstanceOf(DualLayerStore.class, store);
            assertEquals(Optional.of(backing), layered.persistentLayer());
        }

        @Test
        @DisplayName("should fail when the provider's store is unhealthy")
        void shouldFailWhenUnhealthy(@Mock KeyValueStore<String> unhealthy) {
            when(unhealthy.connect()).thenReturn(Uni.createFrom().voidItem());
            when(unhealthy.healthCheck()).thenReturn(Uni.createFrom().item(false));

            final var error = assertThrows(
                    StorageProviderException.class,
                    () -> factory(List.of(new FixedProvider("dynamodb", unhealthy)))
                            .create("session", String.class, custom("dynamodb", true))
                            .await()
                            .indefinitely());

            assertEquals("Health check failed for session store", error.getMessage());
        }

        @Test
        @DisplayName("should wrap provider construction failures")
        void shouldWrapProviderFailures() {
            final KeyValueStoreProvider broken = new KeyValueStoreProvider() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public <T> KeyValueStore<T> createStore(String storeName, Class<T> valueType, StoreSettings settings) {
                    throw new IllegalStateException("no credentials");
                }
            };

            final var error = assertThrows(
                    StorageProviderException.class,
                    () -> factory(List.of(broken))
                            .create("session", String.class, custom("broken", false))
                            .await()
                            .indefinitely());

            assertInstanceOf(IllegalStateException.class, error.getCause());
        }
    }

    @Nested
    @DisplayName("requireStoreContract()")
    class RequireStoreContractTests {

        @Test
        @DisplayName("should reject a missing store")
        void shouldRejectNull() {
            final var error = assertThrows(
                    StorageProviderException.class, () -> StoreFactory.requireStoreContract("p", null));

            assertEquals("Provider 'p' returned no store", error.getMessage());
        }

        @Test
        @DisplayName("should list every missing operation")
        void shouldListMissingOperations() {
            final var error = assertThrows(
                    StorageProviderException.class,
                    () -> StoreFactory.requireStoreContract("p", new HalfStore()));

            assertTrue(error.getMessage().contains("[close, connect, exists, healthCheck]"));
        }

        @Test
        @DisplayName("should accept a full store")
        void shouldAcceptFullStore() {
            final var store = new MemoryStore<String>("x");

            assertSame(store, StoreFactory.requireStoreContract("p", store));
        }
    }

    private static final class FixedProvider implements KeyValueStoreProvider {

        private final String name;
        private final KeyValueStore<?> store;

        FixedProvider(String name, KeyValueStore<?> store) {
            this.name = name;
            this.store = store;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> KeyValueStore<T> createStore(String storeName, Class<T> valueType, StoreSettings settings) {
            return (KeyValueStore<T>) store;
        }
    }

    /**
     * Looks like a store but only implements part of it.
     */
    public static final class HalfStore {

        public Uni<Optional<String>> get(String key) {
            return Uni.createFrom().item(Optional.empty());
        }

        public Uni<Void> set(String key, String value, Duration ttl) {
            return Uni.createFrom().voidItem();
        }

        public Uni<Boolean> delete(String key) {
            return Uni.createFrom().item(false);
        }
    }
}
