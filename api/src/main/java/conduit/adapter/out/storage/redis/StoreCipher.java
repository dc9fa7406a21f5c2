package conduit.adapter.out.storage.redis;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * At-rest encryption for persisted store records.
 *
 * <p>Uses AES-256-GCM with a fresh 12-byte IV per record. The stored form is
 * {@code base64(keyIdLength | keyId | iv | ciphertext+tag)}. Without a key, records are
 * stored as {@code PLAIN:base64(json)}.
 *
 * <h2>Configuration</h2>
 * <pre>
 * conduit.storage.encryption-key=${STORE_ENCRYPTION_KEY}  # Base64-encoded 256-bit key
 * </pre>
 */
public class StoreCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final String PLAIN_PREFIX = "PLAIN:";
    private static final String DEFAULT_KEY_ID = "v1";

    private final SecretKey secretKey;
    private final String keyId;
    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * @param encryptionKey optional base64-encoded 256-bit key
     * @throws IllegalArgumentException if the key is not 32 bytes
     */
    public StoreCipher(Optional<String> encryptionKey) {
        this.keyId = DEFAULT_KEY_ID;
        if (encryptionKey.isPresent() && !encryptionKey.get().isBlank()) {
            final byte[] keyBytes = Base64.getDecoder().decode(encryptionKey.get().trim());
            if (keyBytes.length != 32) {
                throw new IllegalArgumentException(
                        "Store encryption key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
            }
            this.secretKey = new SecretKeySpec(keyBytes, "AES");
        } else {
            this.secretKey = null;
        }
    }

    public static StoreCipher plaintext() {
        return new StoreCipher(Optional.empty());
    }

    public boolean isEncryptionEnabled() {
        return secretKey != null;
    }

    /**
     * Seal a serialized record for storage.
     *
     * @param plaintext the serialized record
     * @return the stored form
     */
    public String seal(String plaintext) {
        final byte[] data = plaintext.getBytes(StandardCharsets.UTF_8);
        if (secretKey == null) {
            return PLAIN_PREFIX + Base64.getEncoder().encodeToString(data);
        }

        try {
            final byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            final byte[] ciphertext = cipher.doFinal(data);
            final byte[] keyIdBytes = keyId.getBytes(StandardCharsets.UTF_8);

            final ByteBuffer buffer = ByteBuffer.allocate(1 + keyIdBytes.length + IV_LENGTH + ciphertext.length);
            buffer.put((byte) keyIdBytes.length);
            buffer.put(keyIdBytes);
            buffer.put(iv);
            buffer.put(ciphertext);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt store record", e);
        }
    }

    /**
     * Open a stored record.
     *
     * @param stored the stored form
     * @return the serialized record
     * @throws IllegalStateException if the record cannot be decrypted or decoded
     */
    public String open(String stored) {
        if (stored.startsWith(PLAIN_PREFIX)) {
            if (secretKey != null) {
                throw new IllegalStateException("Plaintext store record rejected: encryption is enabled");
            }
            return decodeBase64(stored.substring(PLAIN_PREFIX.length()));
        }
        if (secretKey == null) {
            throw new IllegalStateException("Record is encrypted but no store encryption key is configured");
        }

        try {
            final ByteBuffer buffer = ByteBuffer.wrap(Base64.getDecoder().decode(stored));
            final int keyIdLength = buffer.get() & 0xFF;
            buffer.position(buffer.position() + keyIdLength);

            final byte[] iv = new byte[IV_LENGTH];
            buffer.get(iv);
            final byte[] ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | RuntimeException e) {
            throw new IllegalStateException("Failed to decrypt store record", e);
        }
    }

    private static String decodeBase64(String encoded) {
        try {
            return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Malformed plaintext store record", e);
        }
    }
}
