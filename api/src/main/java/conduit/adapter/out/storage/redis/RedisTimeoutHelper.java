package conduit.adapter.out.storage.redis;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import conduit.core.model.storage.StoreException;
import conduit.core.port.out.Metrics;

/**
 * Helper for applying timeouts and failure handling to Redis operations.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: timeouts and backend errors fail the operation with
 *       {@link StoreException}. Used for every read and write of OAuth and session state.</li>
 *   <li>{@link #withTimeoutFallback} - Fail-soft: returns a fallback on timeout or any failure.
 *       Used for health probes, which must never fail.</li>
 * </ul>
 *
 * <h2>Metrics</h2>
 * Records separate metrics for timeouts ({@code conduit.store.timeouts.total}) and
 * non-timeout failures ({@code conduit.store.failures.total}).
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;
    private final String storeName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording timeouts (may be null)
     * @param storeName the logical store name for logging and metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics, String storeName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.storeName = storeName;
    }

    /**
     * Apply timeout to an operation that must fail when Redis is slow or unavailable.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with {@link StoreException} on timeout or backend failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, storeName, timeout);
                    recordTimeout(operationName);
                    return new StoreException(storeName, operationName, "Store operation timed out: " + operationName);
                })
                .onFailure(error -> !(error instanceof StoreException))
                .transform(error -> {
                    LOG.warnv("Redis operation failure: {0} in {1}: {2}", operationName, storeName, error.getMessage());
                    recordFailure(operationName);
                    return new StoreException(storeName, operationName, error);
                });
    }

    /**
     * Apply timeout with graceful degradation to a fallback value.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param fallback supplier for fallback value on timeout or failure
     * @param <T> the result type
     * @return a Uni that returns the fallback value on timeout or failure
     */
    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (fallback): {0} in {1} after {2}",
                            operationName, storeName, timeout);
                    recordTimeout(operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (fallback): {0} in {1}: {2}",
                            operationName, storeName, error.getMessage());
                    recordFailure(operationName);
                    return fallback.get();
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(storeName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(storeName, operationName);
        }
    }
}
