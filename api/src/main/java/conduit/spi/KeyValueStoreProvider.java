package conduit.spi;

import conduit.core.model.storage.StoreSettings;
import conduit.core.port.out.KeyValueStore;

/**
 * SPI for operator-supplied key-value store backends.
 *
 * <p>Implementations are CDI beans discovered by name. Select one with:
 *
 * <pre>
 * conduit.storage.type=custom
 * conduit.storage.provider=dynamodb
 * </pre>
 *
 * <p>The factory connects and health-checks every created store before use; a store that
 * fails either check aborts startup.
 *
 * <h2>Custom Implementation Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class DynamoDbStoreProvider implements KeyValueStoreProvider {
 *
 *     @Override
 *     public String name() {
 *         return "dynamodb";
 *     }
 *
 *     @Override
 *     public <T> KeyValueStore<T> createStore(String storeName, Class<T> valueType, StoreSettings settings) {
 *         return new DynamoDbStore<>(client, settings.keyPrefix(), valueType);
 *     }
 * }
 * }</pre>
 *
 * <p>The returned store must expire records after the TTL passed to {@code set} and must
 * never return an expired record.
 */
public interface KeyValueStoreProvider {

    /**
     * Provider name used in {@code conduit.storage.provider}.
     *
     * @return provider name (e.g., "dynamodb")
     */
    String name();

    /**
     * Human-readable description of this provider.
     *
     * @return description for logging and diagnostics
     */
    default String description() {
        return name() + " key-value store provider";
    }

    /**
     * Create a store for one logical namespace.
     *
     * @param storeName logical store name, for logging
     * @param valueType the value type to serialize
     * @param settings settings including the key prefix
     * @param <T> the value type
     * @return a new store instance
     */
    <T> KeyValueStore<T> createStore(String storeName, Class<T> valueType, StoreSettings settings);
}
