package conduit.core.model.storage;

/**
 * A key-value store operation failed or timed out.
 *
 * <p>Surfaced to OAuth clients as {@code server_error}.
 */
public class StoreException extends RuntimeException {

    private final String store;
    private final String operation;

    public StoreException(String store, String operation, Throwable cause) {
        super("Store operation failed: " + operation + " in " + store, cause);
        this.store = store;
        this.operation = operation;
    }

    public StoreException(String store, String operation, String message) {
        super(message);
        this.store = store;
        this.operation = operation;
    }

    public String getStore() {
        return store;
    }

    public String getOperation() {
        return operation;
    }
}
