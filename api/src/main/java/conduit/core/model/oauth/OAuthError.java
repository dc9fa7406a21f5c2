package conduit.core.model.oauth;

/**
 * RFC 6749 / RFC 6750 error codes returned by the authorization and resource server.
 */
public enum OAuthError {
    INVALID_REQUEST("invalid_request", 400),
    INVALID_GRANT("invalid_grant", 400),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", 400),
    UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type", 400),
    INVALID_REDIRECT_URI("invalid_redirect_uri", 400),
    ACCESS_DENIED("access_denied", 400),
    UNAUTHORIZED("unauthorized", 401),
    INVALID_TOKEN("invalid_token", 401),
    INSUFFICIENT_SCOPE("insufficient_scope", 403),
    SERVER_ERROR("server_error", 500);

    private final String code;
    private final int status;

    OAuthError(String code, int status) {
        this.code = code;
        this.status = status;
    }

    /** Wire value of the {@code error} field. */
    public String code() {
        return code;
    }

    /** HTTP status used when the error is rendered. */
    public int status() {
        return status;
    }
}
