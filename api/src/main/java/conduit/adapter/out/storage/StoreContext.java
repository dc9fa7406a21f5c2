package conduit.adapter.out.storage;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.runtime.Startup;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import conduit.core.config.StorageConfig;
import conduit.core.model.oauth.AuthorizationCode;
import conduit.core.model.oauth.PendingAuthorization;
import conduit.core.model.oauth.RefreshTokenData;
import conduit.core.model.session.SessionRecord;
import conduit.core.model.storage.StoreSettings;
import conduit.core.model.storage.StoreType;
import conduit.core.port.out.AuthorizationCodeStore;
import conduit.core.port.out.KeyValueStore;
import conduit.core.port.out.Metrics;
import conduit.core.port.out.PendingAuthorizationStore;
import conduit.core.port.out.RefreshTokenStore;
import conduit.core.port.out.SessionStore;
import conduit.spi.KeyValueStoreProvider;

/**
 * Owns the process-wide OAuth and session stores.
 *
 * <p>All four stores are created once at startup through {@link StoreFactory}; startup fails if
 * any backend is unreachable. The typed façades are exposed as CDI beans and closed at shutdown.
 */
@Startup
@ApplicationScoped
public class StoreContext {

    private static final Logger LOG = Logger.getLogger(StoreContext.class);
    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final StorageConfig config;
    private final StoreFactory factory;

    private volatile PendingAuthorizationStore pendingAuthorizations;
    private volatile AuthorizationCodeStore authorizationCodes;
    private volatile RefreshTokenStore refreshTokens;
    private volatile SessionStore sessions;

    @Inject
    public StoreContext(
            StorageConfig config,
            Instance<ReactiveRedisDataSource> redisDataSource,
            ObjectMapper objectMapper,
            Instance<KeyValueStoreProvider> providers,
            Metrics metrics,
            Clock clock) {
        this.config = config;
        this.factory = new StoreFactory(redisDataSource::get, objectMapper, providers, metrics, clock);
    }

    @Produces
    @ApplicationScoped
    public PendingAuthorizationStore pendingAuthorizationStore() {
        initialize();
        return pendingAuthorizations;
    }

    @Produces
    @ApplicationScoped
    public AuthorizationCodeStore authorizationCodeStore() {
        initialize();
        return authorizationCodes;
    }

    @Produces
    @ApplicationScoped
    public RefreshTokenStore refreshTokenStore() {
        initialize();
        return refreshTokens;
    }

    @Produces
    @ApplicationScoped
    public SessionStore sessionStore() {
        initialize();
        return sessions;
    }

    /**
     * Health of every store, keyed by store name. Never fails.
     */
    public Uni<Map<String, Boolean>> healthChecks() {
        initialize();
        final Map<String, KeyValueStore<?>> stores = all();
        return Multi.createFrom()
                .iterable(stores.entrySet())
                .onItem()
                .transformToUniAndConcatenate(entry -> entry.getValue()
                        .healthCheck()
                        .onFailure()
                        .recoverWithItem(false)
                        .map(healthy -> Map.entry(entry.getKey(), healthy)))
                .collect()
                .asMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    public StoreType storeType() {
        return StoreType.fromName(config.type());
    }

    @PostConstruct
    synchronized void initialize() {
        if (sessions != null) {
            return;
        }
        final var base = baseSettings();
        final var prefixes = config.keyPrefix();
        LOG.infof("Initializing %s stores (memory cache: %s)", base.type(), base.cacheInMemory());

        pendingAuthorizations = Stores.pendingAuthorizations(create(
                "pending-authorization",
                PendingAuthorization.class,
                base.withKeyPrefix(prefixes.pendingAuthorization())));
        authorizationCodes = Stores.authorizationCodes(create(
                "authorization-code", AuthorizationCode.class, base.withKeyPrefix(prefixes.authorizationCode())));
        refreshTokens = Stores.refreshTokens(
                create("refresh-token", RefreshTokenData.class, base.withKeyPrefix(prefixes.refreshToken())));
        sessions = Stores.sessions(create("session", SessionRecord.class, base.withKeyPrefix(prefixes.session())));
    }

    private <T> KeyValueStore<T> create(String name, Class<T> type, StoreSettings settings) {
        return factory.create(name, type, settings).await().atMost(STARTUP_TIMEOUT);
    }

    private StoreSettings baseSettings() {
        return new StoreSettings(
                StoreType.fromName(config.type()),
                config.provider(),
                "",
                config.cacheInMemory(),
                config.operationTimeout(),
                config.encryptionKey());
    }

    private Map<String, KeyValueStore<?>> all() {
        final Map<String, KeyValueStore<?>> stores = new LinkedHashMap<>();
        stores.put("pending-authorization", pendingAuthorizations);
        stores.put("authorization-code", authorizationCodes);
        stores.put("refresh-token", refreshTokens);
        stores.put("session", sessions);
        return stores;
    }

    @PreDestroy
    void close() {
        if (sessions == null) {
            return;
        }
        all().forEach((name, store) -> {
            try {
                store.close().await().atMost(Duration.ofSeconds(5));
            } catch (RuntimeException e) {
                LOG.warnf("Failed to close %s store: %s", name, e.getMessage());
            }
        });
    }
}
