package conduit.core.service.oauth;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import conduit.core.config.OAuthLifetimes;
import conduit.core.model.oauth.AccessTokenClaims;
import conduit.core.model.oauth.OAuthException;
import conduit.core.model.oauth.Tokens;
import conduit.core.model.oauth.UpstreamUser;
import conduit.core.port.out.AccessTokenCodec;

/**
 * Issues and verifies gateway access tokens that wrap upstream credentials.
 */
@ApplicationScoped
public class AccessTokenService {

    private static final Logger LOG = Logger.getLogger(AccessTokenService.class);

    public static final String INVALID_TOKEN_DESCRIPTION = "Invalid or expired access token";

    private final AccessTokenCodec codec;
    private final OAuthLifetimes lifetimes;
    private final Clock clock;

    @Inject
    public AccessTokenService(AccessTokenCodec codec, OAuthLifetimes lifetimes, Clock clock) {
        this.codec = codec;
        this.lifetimes = lifetimes;
        this.clock = clock;
    }

    /**
     * Mint an access token.
     *
     * <p>The token expires at the earlier of the configured access token lifetime and the
     * expiry of the wrapped upstream credential.
     *
     * @throws OAuthException {@code invalid_grant} if the upstream credential has already expired
     */
    public IssuedAccessToken issue(
            UpstreamUser user, String upstreamServer, Tokens tokens, String clientId, Set<String> scopes) {
        final var now = Instant.ofEpochSecond(clock.instant().getEpochSecond());
        final var accessExpiry = now.plus(lifetimes.accessTokenTtl());
        final var upstreamExpiry = Instant.ofEpochSecond(tokens.expiresAt().getEpochSecond());
        final var expiresAt = upstreamExpiry.isBefore(accessExpiry) ? upstreamExpiry : accessExpiry;

        final long expiresIn = expiresAt.getEpochSecond() - now.getEpochSecond();
        if (expiresIn <= 0) {
            throw OAuthException.invalidGrant("Upstream credentials have expired");
        }

        final var claims = new AccessTokenClaims(
                SecureTokens.randomUuid(),
                user.name(),
                clientId,
                scopes,
                upstreamServer,
                user.id(),
                tokens,
                now,
                expiresAt);
        LOG.debugf("Issued access token %s for client %s, expires in %ds", claims.tokenId(), clientId, expiresIn);
        return new IssuedAccessToken(codec.encode(claims), expiresIn);
    }

    /**
     * Verify an access token.
     *
     * @param token the bearer token
     * @return the claims, or empty if the token or its wrapped upstream credential is invalid or expired
     */
    public Optional<AccessTokenClaims> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        final var now = clock.instant();
        return codec.decode(token, now).filter(claims -> {
            if (!now.isBefore(claims.tokens().expiresAt())) {
                LOG.debugf("Access token %s wraps an expired upstream credential", claims.tokenId());
                return false;
            }
            return true;
        });
    }

    /**
     * A freshly minted access token.
     *
     * @param token the encrypted token
     * @param expiresIn lifetime in seconds
     */
    public record IssuedAccessToken(String token, long expiresIn) {}
}
