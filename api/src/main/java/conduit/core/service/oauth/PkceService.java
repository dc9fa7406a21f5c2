package conduit.core.service.oauth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * PKCE (Proof Key for Code Exchange) operations.
 *
 * <p>Implements RFC 7636 for protecting authorization code flows against
 * interception attacks. Only the S256 challenge method is supported as
 * the plain method provides insufficient security.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String S256_METHOD = "S256";

    /**
     * Validate the challenge method.
     *
     * @param method The challenge method from the request
     * @return true if the method is valid (S256)
     */
    public boolean isValidChallengeMethod(String method) {
        return S256_METHOD.equals(method);
    }

    /**
     * Generate S256 challenge from verifier.
     *
     * <p>Computes: BASE64URL(SHA256(verifier))
     *
     * @param verifier The code verifier
     * @return Base64URL encoded SHA-256 hash of the verifier
     */
    public String generateChallenge(String verifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-256
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Check a code verifier against a stored challenge.
     *
     * @param verifier the code_verifier from the token request
     * @param challenge the code_challenge recorded at authorization time
     * @return true if {@code S256(verifier)} equals the challenge
     */
    public boolean verify(String verifier, String challenge) {
        if (verifier == null || verifier.isBlank() || challenge == null) {
            return false;
        }
        return constantTimeEquals(generateChallenge(verifier), challenge);
    }

    static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
