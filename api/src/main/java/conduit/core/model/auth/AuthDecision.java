package conduit.core.model.auth;

import conduit.core.model.oauth.OAuthError;

/**
 * Outcome of authenticating and authorizing a protocol request.
 */
public sealed interface AuthDecision {

    /**
     * Request may proceed.
     *
     * @param context the authenticated caller
     */
    record Allowed(AuthContext context) implements AuthDecision {}

    /**
     * Request is rejected.
     *
     * @param error OAuth error code; its status is the HTTP status
     * @param description human readable reason
     * @param challenge value of the {@code WWW-Authenticate} header
     * @param eventStream whether the denial must be framed as a server-sent event
     */
    record Denied(OAuthError error, String description, String challenge, boolean eventStream)
            implements AuthDecision {

        public int status() {
            return error.status();
        }
    }
}
