package conduit.core.port.out;

import java.time.Instant;
import java.util.Optional;

import conduit.core.model.oauth.AccessTokenClaims;

/**
 * Encrypts access token claims into an opaque bearer token and back.
 */
public interface AccessTokenCodec {

    /**
     * Seal claims into a compact token string.
     *
     * @param claims the claims, including the wrapped upstream credentials
     * @return the bearer token
     */
    String encode(AccessTokenClaims claims);

    /**
     * Open and validate a token: decryption, algorithms, issuer, audience and expiry.
     *
     * @param token the bearer token
     * @param now evaluation time; no clock skew is allowed
     * @return the claims, or empty if the token is invalid for any reason
     */
    Optional<AccessTokenClaims> decode(String token, Instant now);
}
