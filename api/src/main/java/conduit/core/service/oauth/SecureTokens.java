package conduit.core.service.oauth;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Random identifiers for codes, states and refresh tokens.
 */
public final class SecureTokens {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final int TOKEN_BYTES = 32;

    private SecureTokens() {
        // Utility class - prevent instantiation
    }

    /**
     * 32 random bytes, hex encoded (64 characters).
     */
    public static String randomHex() {
        final var bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public static String randomUuid() {
        return UUID.randomUUID().toString();
    }

    /**
     * First characters of a secret, safe for debug logging.
     */
    public static String abbreviate(String secret) {
        if (secret == null) {
            return "null";
        }
        return secret.substring(0, Math.min(8, secret.length())) + "...";
    }
}
