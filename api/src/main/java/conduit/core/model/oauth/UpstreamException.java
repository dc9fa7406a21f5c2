package conduit.core.model.oauth;

/**
 * The upstream platform rejected a request or could not be reached.
 */
public class UpstreamException extends RuntimeException {

    private final int status;

    public UpstreamException(String message, int status) {
        super(message);
        this.status = status;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    /** HTTP status returned upstream, or 0 if no response was received. */
    public int getStatus() {
        return status;
    }

    /** Whether the upstream answered with a 4xx, i.e. rejected the client's input. */
    public boolean isRejection() {
        return status >= 400 && status < 500;
    }
}
