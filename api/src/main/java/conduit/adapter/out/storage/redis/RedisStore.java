package conduit.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import conduit.core.model.storage.StoreEntry;
import conduit.core.model.storage.StoreException;
import conduit.core.port.out.KeyValueStore;
import conduit.core.port.out.Metrics;

/**
 * Redis implementation of {@link KeyValueStore}.
 *
 * <p>Values are serialized as a JSON envelope {@code {"value": ..., "expiresAt": epochMillis}},
 * sealed by {@link StoreCipher} and written with a native Redis TTL ({@code PSETEX}). Reads
 * re-check {@code expiresAt}, so a record is never served past its TTL even if Redis has not
 * evicted it yet. A record that cannot be decrypted or parsed is treated as absent.
 *
 * <p>{@link #consume} uses GETDEL for atomic retrieve-and-delete.
 *
 * <p>Every operation carries the configured timeout; timeouts and backend errors fail with
 * {@link StoreException}. {@link #healthCheck()} never fails.
 *
 * @param <T> the value type
 */
public class RedisStore<T> implements KeyValueStore<T> {

    private static final Logger LOG = Logger.getLogger(RedisStore.class);
    private static final String VALUE_FIELD = "value";
    private static final String EXPIRES_AT_FIELD = "expiresAt";

    private final String name;
    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ObjectMapper objectMapper;
    private final Class<T> valueType;
    private final String keyPrefix;
    private final StoreCipher cipher;
    private final RedisTimeoutHelper timeoutHelper;
    private final Clock clock;

    public RedisStore(
            String name,
            ReactiveRedisDataSource redisDataSource,
            ObjectMapper objectMapper,
            Class<T> valueType,
            String keyPrefix,
            Duration timeout,
            StoreCipher cipher,
            Metrics metrics,
            Clock clock) {
        this.name = name;
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.objectMapper = objectMapper;
        this.valueType = valueType;
        this.keyPrefix = keyPrefix;
        this.cipher = cipher;
        this.timeoutHelper = new RedisTimeoutHelper(timeout, metrics, name);
        this.clock = clock;
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
        return timeoutHelper
                .withTimeout(valueCommands.get(keyPrefix + key), "get")
                .map(this::decode);
    }

    @Override
    public Uni<Void> set(String key, T value, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return Uni.createFrom().failure(new IllegalArgumentException("ttl must be positive"));
        }
        final String payload;
        try {
            payload = encode(value, clock.instant().plus(ttl));
        } catch (JsonProcessingException e) {
            return Uni.createFrom().failure(new StoreException(name, "set", e));
        }

        return timeoutHelper
                .withTimeout(valueCommands.psetex(keyPrefix + key, ttl.toMillis(), payload), "set")
                .invoke(() -> LOG.debugf("Stored %s record with TTL: %s", name, ttl));
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return timeoutHelper
                .withTimeout(keyCommands.del(keyPrefix + key), "delete")
                .map(removed -> removed != null && removed > 0);
    }

    @Override
    public Uni<Optional<T>> consume(String key) {
        // GETDEL (Redis 6.2+) makes retrieve-and-delete atomic across instances
        return timeoutHelper
                .withTimeout(valueCommands.getdel(keyPrefix + key), "consume")
                .map(this::decode)
                .map(entry -> entry.map(StoreEntry::value));
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return getEntry(key).map(Optional::isPresent);
    }

    @Override
    public Uni<Void> connect() {
        return timeoutHelper
                .withTimeout(redisDataSource.execute("PING"), "connect")
                .invoke(() -> LOG.infof("Connected %s store to Redis (encryption: %s)", name, cipher.isEncryptionEnabled()))
                .replaceWithVoid();
    }

    @Override
    public Uni<Boolean> healthCheck() {
        return timeoutHelper.withTimeoutFallback(
                redisDataSource.execute("PING").map(response -> response != null && "PONG".equals(response.toString())),
                "healthCheck",
                () -> false);
    }

    @Override
    public Uni<Void> close() {
        // The data source is owned by the Redis client extension
        return Uni.createFrom().voidItem();
    }

    private String encode(T value, Instant expiresAt) throws JsonProcessingException {
        final var envelope = objectMapper.createObjectNode();
        envelope.set(VALUE_FIELD, objectMapper.valueToTree(value));
        envelope.put(EXPIRES_AT_FIELD, expiresAt.toEpochMilli());
        return cipher.seal(objectMapper.writeValueAsString(envelope));
    }

    private Optional<StoreEntry<T>> decode(String stored) {
        if (stored == null) {
            return Optional.empty();
        }
        try {
            final var envelope = objectMapper.readTree(cipher.open(stored));
            final var expiresAtNode = envelope.get(EXPIRES_AT_FIELD);
            final var valueNode = envelope.get(VALUE_FIELD);
            if (expiresAtNode == null || valueNode == null || valueNode.isNull()) {
                LOG.warnf("Ignoring malformed %s record", name);
                return Optional.empty();
            }
            final var expiresAt = Instant.ofEpochMilli(expiresAtNode.asLong());
            if (!clock.instant().isBefore(expiresAt)) {
                return Optional.empty();
            }
            return Optional.of(new StoreEntry<>(objectMapper.treeToValue(valueNode, valueType), expiresAt));
        } catch (JsonProcessingException | IllegalStateException | IllegalArgumentException e) {
            LOG.warnf("Ignoring unreadable %s record: %s", name, e.getMessage());
            return Optional.empty();
        }
    }
}
