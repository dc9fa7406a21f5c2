package conduit.core.model.oauth;

/**
 * An OAuth protocol error, rendered as {@code {"error": ..., "error_description": ...}}.
 */
public class OAuthException extends RuntimeException {

    private final OAuthError error;

    public OAuthException(OAuthError error, String description) {
        super(description);
        this.error = error;
    }

    public OAuthException(OAuthError error, String description, Throwable cause) {
        super(description, cause);
        this.error = error;
    }

    public OAuthError getError() {
        return error;
    }

    public String getDescription() {
        return getMessage();
    }

    public int getStatus() {
        return error.status();
    }

    public static OAuthException invalidRequest(String description) {
        return new OAuthException(OAuthError.INVALID_REQUEST, description);
    }

    public static OAuthException invalidGrant(String description) {
        return new OAuthException(OAuthError.INVALID_GRANT, description);
    }

    public static OAuthException serverError(String description, Throwable cause) {
        return new OAuthException(OAuthError.SERVER_ERROR, description, cause);
    }
}
