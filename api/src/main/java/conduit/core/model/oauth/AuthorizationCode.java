package conduit.core.model.oauth;

import java.time.Instant;

/**
 * A single-use authorization code issued after a successful upstream callback.
 *
 * @param user the upstream identity
 * @param upstreamServer base URL of the upstream platform
 * @param tokens upstream credential pair
 * @param clientId client the code was issued to
 * @param redirectUri redirect URI the code was delivered to
 * @param codeChallenge PKCE challenge the verifier must match
 * @param expiresAt code expiry
 * @param upstreamClientId client id used against the upstream platform
 * @param scope granted scopes, space separated
 */
public record AuthorizationCode(
        UpstreamUser user,
        String upstreamServer,
        Tokens tokens,
        String clientId,
        String redirectUri,
        String codeChallenge,
        Instant expiresAt,
        String upstreamClientId,
        String scope) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
