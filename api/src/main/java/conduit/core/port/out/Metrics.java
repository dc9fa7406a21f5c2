package conduit.core.port.out;

/**
 * Port interface for recording gateway metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a store operation that exceeded its timeout.
     *
     * @param store the logical store name
     * @param operation the operation name
     */
    void recordStoreTimeout(String store, String operation);

    /**
     * Record a store operation that failed for a reason other than a timeout.
     *
     * @param store the logical store name
     * @param operation the operation name
     */
    void recordStoreFailure(String store, String operation);

    /**
     * Record a token endpoint outcome.
     *
     * @param grantType the grant type
     * @param outcome {@code success} or the OAuth error code
     */
    void recordTokenGrant(String grantType, String outcome);

    /**
     * Record a rejected protocol request.
     *
     * @param error the OAuth error code
     */
    void recordAuthDenied(String error);
}
