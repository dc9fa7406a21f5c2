package conduit.adapter.out.auth;

import java.security.Key;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jwe.ContentEncryptionAlgorithmIdentifiers;
import org.jose4j.jwe.JsonWebEncryption;
import org.jose4j.jwe.KeyManagementAlgorithmIdentifiers;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jwk.RsaJwkGenerator;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import conduit.core.config.OAuthConfig;
import conduit.core.model.oauth.AccessTokenClaims;
import conduit.core.model.oauth.Tokens;
import conduit.core.port.out.AccessTokenCodec;
import conduit.core.service.scope.Scopes;

/**
 * JWE access tokens.
 *
 * <p>Key management, in order of preference:
 * <ul>
 *   <li>{@code conduit.oauth.token.secret} - direct AES-256-GCM with a shared 256-bit key</li>
 *   <li>{@code conduit.oauth.token.rsa-jwk} - RSA-OAEP-256 + A256GCM with the configured key</li>
 *   <li>neither - RSA-OAEP-256 + A256GCM with an RSA key generated at startup; tokens do not
 *       survive a restart and are not valid on other instances</li>
 * </ul>
 */
@ApplicationScoped
public class JweAccessTokenCodec implements AccessTokenCodec {

    private static final Logger LOG = Logger.getLogger(JweAccessTokenCodec.class);

    static final String CLIENT_ID = "client_id";
    static final String SCOPE = "scope";
    static final String UPSTREAM_SERVER = "upstream_server";
    static final String UPSTREAM_USER_ID = "upstream_user_id";
    static final String UPSTREAM_ACCESS_TOKEN = "upstream_access_token";
    static final String UPSTREAM_REFRESH_TOKEN = "upstream_refresh_token";
    static final String UPSTREAM_ISSUED_AT = "upstream_issued_at";
    static final String UPSTREAM_EXPIRES_AT = "upstream_expires_at";

    private final String issuer;
    private final String audience;
    private final String keyManagementAlgorithm;
    private final Key encryptionKey;
    private final Key decryptionKey;

    @Inject
    public JweAccessTokenCodec(OAuthConfig config) {
        this(config.issuer(), audience(config), config.token().secret(), config.token().rsaJwk());
    }

    public JweAccessTokenCodec(String issuer, String audience, Optional<String> secret, Optional<String> rsaJwk) {
        this.issuer = issuer;
        this.audience = audience;

        if (secret.isPresent() && !secret.get().isBlank()) {
            final byte[] keyBytes = Base64.getDecoder().decode(secret.get().trim());
            if (keyBytes.length != 32) {
                throw new IllegalArgumentException(
                        "Token secret must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
            }
            final var key = new SecretKeySpec(keyBytes, "AES");
            this.keyManagementAlgorithm = KeyManagementAlgorithmIdentifiers.DIRECT;
            this.encryptionKey = key;
            this.decryptionKey = key;
            LOG.info("Access tokens use direct AES-256-GCM encryption");
            return;
        }

        final PublicJsonWebKey jwk = rsaJwk.filter(json -> !json.isBlank())
                .map(JweAccessTokenCodec::parseRsaJwk)
                .orElseGet(JweAccessTokenCodec::generateRsaJwk);
        this.keyManagementAlgorithm = KeyManagementAlgorithmIdentifiers.RSA_OAEP_256;
        this.encryptionKey = jwk.getPublicKey();
        this.decryptionKey = jwk.getPrivateKey();
    }

    static String audience(OAuthConfig config) {
        return config.issuer() + config.resourcePath();
    }

    private static PublicJsonWebKey parseRsaJwk(String json) {
        try {
            final var jwk = JsonWebKey.Factory.newJwk(json);
            if (!(jwk instanceof PublicJsonWebKey publicJwk) || publicJwk.getPrivateKey() == null) {
                throw new IllegalArgumentException("conduit.oauth.token.rsa-jwk must be an RSA private key");
            }
            LOG.info("Access tokens use RSA-OAEP-256 with the configured key");
            return publicJwk;
        } catch (JoseException e) {
            throw new IllegalArgumentException("Invalid conduit.oauth.token.rsa-jwk: " + e.getMessage(), e);
        }
    }

    private static PublicJsonWebKey generateRsaJwk() {
        try {
            LOG.warn("No access token key configured; generated an ephemeral RSA key. "
                    + "Tokens will not survive a restart. Set conduit.oauth.token.secret to persist them.");
            return RsaJwkGenerator.generateJwk(2048);
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to generate RSA key for access tokens", e);
        }
    }

    @Override
    public String encode(AccessTokenClaims claims) {
        final var jwtClaims = new JwtClaims();
        jwtClaims.setIssuer(issuer);
        jwtClaims.setAudience(audience);
        jwtClaims.setSubject(claims.subject());
        jwtClaims.setJwtId(claims.tokenId());
        jwtClaims.setIssuedAt(NumericDate.fromSeconds(claims.issuedAt().getEpochSecond()));
        jwtClaims.setExpirationTime(NumericDate.fromSeconds(claims.expiresAt().getEpochSecond()));
        jwtClaims.setStringClaim(CLIENT_ID, claims.clientId());
        jwtClaims.setStringClaim(SCOPE, Scopes.format(claims.scopes()));
        jwtClaims.setStringClaim(UPSTREAM_SERVER, claims.upstreamServer());
        jwtClaims.setStringClaim(UPSTREAM_USER_ID, claims.userId());
        jwtClaims.setStringClaim(UPSTREAM_ACCESS_TOKEN, claims.tokens().accessToken());
        if (claims.tokens().refreshToken() != null) {
            jwtClaims.setStringClaim(UPSTREAM_REFRESH_TOKEN, claims.tokens().refreshToken());
        }
        jwtClaims.setClaim(UPSTREAM_ISSUED_AT, claims.tokens().issuedAt().toEpochMilli());
        jwtClaims.setClaim(UPSTREAM_EXPIRES_AT, claims.tokens().expiresAt().toEpochMilli());

        final var jwe = new JsonWebEncryption();
        jwe.setPayload(jwtClaims.toJson());
        jwe.setAlgorithmHeaderValue(keyManagementAlgorithm);
        jwe.setEncryptionMethodHeaderParameter(ContentEncryptionAlgorithmIdentifiers.AES_256_GCM);
        jwe.setKey(encryptionKey);
        try {
            return jwe.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to encrypt access token", e);
        }
    }

    @Override
    public Optional<AccessTokenClaims> decode(String token, Instant now) {
        final JwtConsumer consumer = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setRequireSubject()
                .setRequireJwtId()
                .setAllowedClockSkewInSeconds(0)
                .setEvaluationTime(NumericDate.fromMilliseconds(now.toEpochMilli()))
                .setExpectedIssuer(issuer)
                .setExpectedAudience(audience)
                .setDecryptionKey(decryptionKey)
                .setDisableRequireSignature()
                .setEnableRequireEncryption()
                .setJweAlgorithmConstraints(new AlgorithmConstraints(ConstraintType.PERMIT, keyManagementAlgorithm))
                .setJweContentEncryptionAlgorithmConstraints(new AlgorithmConstraints(
                        ConstraintType.PERMIT, ContentEncryptionAlgorithmIdentifiers.AES_256_GCM))
                .build();
        try {
            return Optional.of(toClaims(consumer.processToClaims(token)));
        } catch (InvalidJwtException e) {
            LOG.debugv("Access token rejected: {0}", e.getMessage());
            return Optional.empty();
        } catch (MalformedClaimException | RuntimeException e) {
            LOG.debugv("Access token has malformed claims: {0}", e.getMessage());
            return Optional.empty();
        }
    }

    private AccessTokenClaims toClaims(JwtClaims claims) throws MalformedClaimException {
        final var upstreamIssuedAt = Instant.ofEpochMilli(requireLong(claims, UPSTREAM_ISSUED_AT));
        final var upstreamExpiresAt = Instant.ofEpochMilli(requireLong(claims, UPSTREAM_EXPIRES_AT));
        final var tokens = new Tokens(
                claims.getStringClaimValue(UPSTREAM_ACCESS_TOKEN),
                claims.getStringClaimValue(UPSTREAM_REFRESH_TOKEN),
                Duration.between(upstreamIssuedAt, upstreamExpiresAt).getSeconds(),
                upstreamIssuedAt);
        final Set<String> scopes = new HashSet<>(Scopes.parse(claims.getStringClaimValue(SCOPE)));

        return new AccessTokenClaims(
                claims.getJwtId(),
                claims.getSubject(),
                claims.getStringClaimValue(CLIENT_ID),
                scopes,
                claims.getStringClaimValue(UPSTREAM_SERVER),
                claims.getStringClaimValue(UPSTREAM_USER_ID),
                tokens,
                Instant.ofEpochSecond(claims.getIssuedAt().getValue()),
                Instant.ofEpochSecond(claims.getExpirationTime().getValue()));
    }

    private static long requireLong(JwtClaims claims, String name) throws MalformedClaimException {
        final var value = claims.getClaimValue(name, Long.class);
        if (value == null) {
            throw new MalformedClaimException("Missing claim " + name);
        }
        return value;
    }
}
