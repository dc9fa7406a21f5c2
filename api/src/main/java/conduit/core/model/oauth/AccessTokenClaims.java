package conduit.core.model.oauth;

import java.time.Instant;
import java.util.Set;

/**
 * Decrypted content of a gateway access token.
 *
 * @param tokenId unique token id ({@code jti})
 * @param subject upstream user name
 * @param clientId client the token was issued to
 * @param scopes granted scopes
 * @param upstreamServer base URL of the upstream platform
 * @param userId upstream user id
 * @param tokens the wrapped upstream credential pair
 * @param issuedAt issue time
 * @param expiresAt expiry time
 */
public record AccessTokenClaims(
        String tokenId,
        String subject,
        String clientId,
        Set<String> scopes,
        String upstreamServer,
        String userId,
        Tokens tokens,
        Instant issuedAt,
        Instant expiresAt) {

    public AccessTokenClaims {
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }
}
