package conduit.spi;

/**
 * Exception thrown when a store cannot be created or fails its startup checks.
 */
public class StorageProviderException extends RuntimeException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
