package conduit.core.model.storage;

import java.time.Duration;
import java.util.Optional;

/**
 * Settings for constructing one logical store.
 *
 * @param type backend kind
 * @param provider provider name, required when {@code type} is {@link StoreType#CUSTOM}
 * @param keyPrefix namespace prefix applied to every key
 * @param cacheInMemory whether a persistent or custom backend is fronted by a memory layer
 * @param operationTimeout timeout applied to each backend operation
 * @param encryptionKey optional base64 256-bit key for at-rest encryption
 */
public record StoreSettings(
        StoreType type,
        Optional<String> provider,
        String keyPrefix,
        boolean cacheInMemory,
        Duration operationTimeout,
        Optional<String> encryptionKey) {

    public StoreSettings {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (keyPrefix == null) {
            keyPrefix = "";
        }
        if (provider == null) {
            provider = Optional.empty();
        }
        if (encryptionKey == null) {
            encryptionKey = Optional.empty();
        }
        if (operationTimeout == null) {
            operationTimeout = Duration.ofSeconds(2);
        }
        if (type == StoreType.CUSTOM && provider.isEmpty()) {
            throw new IllegalArgumentException("A custom store requires a provider name");
        }
    }

    public static StoreSettings memory(String keyPrefix) {
        return new StoreSettings(StoreType.MEMORY, Optional.empty(), keyPrefix, false, null, Optional.empty());
    }

    /**
     * Copy of these settings with a different key prefix.
     */
    public StoreSettings withKeyPrefix(String prefix) {
        return new StoreSettings(type, provider, prefix, cacheInMemory, operationTimeout, encryptionKey);
    }
}
