package conduit.core.model.auth;

import java.util.Set;

import conduit.core.model.oauth.AccessTokenClaims;

/**
 * Authenticated caller of the protocol endpoint.
 *
 * @param claims verified access token content
 */
public record AuthContext(AccessTokenClaims claims) {

    public String subject() {
        return claims.subject();
    }

    public Set<String> scopes() {
        return claims.scopes();
    }

    public String upstreamAccessToken() {
        return claims.tokens().accessToken();
    }
}
