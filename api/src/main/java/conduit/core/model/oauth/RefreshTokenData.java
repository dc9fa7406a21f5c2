package conduit.core.model.oauth;

import java.time.Instant;

/**
 * State behind an issued refresh token id.
 *
 * @param user the upstream identity
 * @param upstreamServer base URL of the upstream platform
 * @param tokens upstream credential pair, replaced when the upstream refresh succeeds
 * @param clientId client the refresh token was issued to
 * @param expiresAt refresh token expiry
 * @param upstreamClientId client id used against the upstream platform
 * @param scope granted scopes, space separated
 */
public record RefreshTokenData(
        UpstreamUser user,
        String upstreamServer,
        Tokens tokens,
        String clientId,
        Instant expiresAt,
        String upstreamClientId,
        String scope) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public RefreshTokenData withTokens(Tokens newTokens) {
        return new RefreshTokenData(user, upstreamServer, newTokens, clientId, expiresAt, upstreamClientId, scope);
    }
}
