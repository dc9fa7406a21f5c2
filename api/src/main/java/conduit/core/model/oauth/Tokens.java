package conduit.core.model.oauth;

import java.time.Instant;

/**
 * Upstream platform credential pair wrapped by the gateway's own tokens.
 *
 * @param accessToken upstream access token
 * @param refreshToken upstream refresh token, may be null if the platform issued none
 * @param expiresInSeconds lifetime reported by the upstream at issue time
 * @param issuedAt when the credential pair was obtained
 */
public record Tokens(String accessToken, String refreshToken, long expiresInSeconds, Instant issuedAt) {

    public Tokens {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken cannot be null or blank");
        }
        if (issuedAt == null) {
            throw new IllegalArgumentException("issuedAt cannot be null");
        }
    }

    /**
     * Absolute expiry of the upstream access token.
     */
    public Instant expiresAt() {
        return issuedAt.plusSeconds(expiresInSeconds);
    }

    @Override
    public String toString() {
        return "Tokens[accessToken=***, refreshToken=" + (refreshToken == null ? "null" : "***")
                + ", expiresInSeconds=" + expiresInSeconds + ", issuedAt=" + issuedAt + "]";
    }
}
