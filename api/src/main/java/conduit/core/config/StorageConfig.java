package conduit.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the OAuth and session stores.
 *
 * <p>Configuration prefix: {@code conduit.storage}
 *
 * <p>All four logical stores share one backend; each gets its own key prefix.
 *
 * <pre>
 * conduit.storage.type=persistent
 * conduit.storage.cache-in-memory=true
 * conduit.storage.encryption-key=${STORE_ENCRYPTION_KEY}
 * </pre>
 */
@ConfigMapping(prefix = "conduit.storage")
public interface StorageConfig {

    /**
     * Backend type: {@code memory}, {@code persistent} or {@code custom}.
     *
     * @return store type (default: memory)
     */
    @WithDefault("memory")
    String type();

    /**
     * Name of the {@code KeyValueStoreProvider} used when the type is {@code custom}.
     *
     * @return provider name
     */
    Optional<String> provider();

    /**
     * Front a persistent or custom backend with a process-local memory layer.
     *
     * @return true to layer a memory cache (default: true)
     */
    @WithDefault("true")
    boolean cacheInMemory();

    /**
     * Timeout applied to each backend operation.
     *
     * @return operation timeout (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration operationTimeout();

    /**
     * Base64-encoded 256-bit key for at-rest encryption of persistent records.
     *
     * @return encryption key, unset to store plaintext JSON
     */
    Optional<String> encryptionKey();

    /**
     * Key prefixes per logical store.
     */
    KeyPrefixes keyPrefix();

    /**
     * Key namespace for each logical store.
     */
    interface KeyPrefixes {

        @WithDefault("conduit:pending-authz:")
        String pendingAuthorization();

        @WithDefault("conduit:authz-code:")
        String authorizationCode();

        @WithDefault("conduit:refresh-token:")
        String refreshToken();

        @WithDefault("conduit:session:")
        String session();
    }
}
