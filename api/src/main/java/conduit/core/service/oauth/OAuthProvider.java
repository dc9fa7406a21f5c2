package conduit.core.service.oauth;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import conduit.core.config.OAuthConfig;
import conduit.core.config.OAuthLifetimes;
import conduit.core.model.oauth.AuthorizationCode;
import conduit.core.model.oauth.AuthorizeRequest;
import conduit.core.model.oauth.CallbackRequest;
import conduit.core.model.oauth.ClientRegistration;
import conduit.core.model.oauth.OAuthError;
import conduit.core.model.oauth.OAuthException;
import conduit.core.model.oauth.PendingAuthorization;
import conduit.core.model.oauth.RefreshTokenData;
import conduit.core.model.oauth.TokenGrant;
import conduit.core.model.oauth.TokenRequest;
import conduit.core.model.oauth.Tokens;
import conduit.core.model.oauth.UpstreamException;
import conduit.core.port.in.AuthorizationServer;
import conduit.core.port.out.AuthorizationCodeStore;
import conduit.core.port.out.Metrics;
import conduit.core.port.out.PendingAuthorizationStore;
import conduit.core.port.out.RefreshTokenStore;
import conduit.core.port.out.UpstreamIdentityProvider;
import conduit.core.service.scope.ScopeRegistry;
import conduit.core.service.scope.Scopes;

/**
 * OAuth 2.1 authorization server that delegates user login to the upstream platform.
 *
 * <p>Flow:
 * <ol>
 *   <li>{@link #authorize} stores a pending authorization and redirects to the upstream login</li>
 *   <li>{@link #callback} exchanges the upstream code, resolves the user and issues a
 *       single-use authorization code</li>
 *   <li>{@link #token} redeems the code (PKCE verified) for an encrypted access token wrapping
 *       the upstream credentials plus a reusable refresh token</li>
 * </ol>
 *
 * <p>The client's {@code code_challenge} doubles as the PKCE verifier towards the upstream
 * platform, so the upstream challenge is {@code S256(code_challenge)}.
 */
@ApplicationScoped
public class OAuthProvider implements AuthorizationServer {

    private static final Logger LOG = Logger.getLogger(OAuthProvider.class);

    static final String AUTHORIZATION_CODE = "authorization_code";
    static final String REFRESH_TOKEN = "refresh_token";

    private final OAuthConfig config;
    private final OAuthLifetimes lifetimes;
    private final PendingAuthorizationStore pendingAuthorizations;
    private final AuthorizationCodeStore authorizationCodes;
    private final RefreshTokenStore refreshTokens;
    private final UpstreamIdentityProvider upstream;
    private final AccessTokenService accessTokens;
    private final PkceService pkce;
    private final RedirectUriValidator redirectUris;
    private final ScopeRegistry scopes;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public OAuthProvider(
            OAuthConfig config,
            OAuthLifetimes lifetimes,
            PendingAuthorizationStore pendingAuthorizations,
            AuthorizationCodeStore authorizationCodes,
            RefreshTokenStore refreshTokens,
            UpstreamIdentityProvider upstream,
            AccessTokenService accessTokens,
            PkceService pkce,
            RedirectUriValidator redirectUris,
            ScopeRegistry scopes,
            Metrics metrics,
            Clock clock) {
        this.config = config;
        this.lifetimes = lifetimes;
        this.pendingAuthorizations = pendingAuthorizations;
        this.authorizationCodes = authorizationCodes;
        this.refreshTokens = refreshTokens;
        this.upstream = upstream;
        this.accessTokens = accessTokens;
        this.pkce = pkce;
        this.redirectUris = redirectUris;
        this.scopes = scopes;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Callback URL registered with the upstream platform.
     */
    public String callbackUrl() {
        return config.issuer() + config.callbackPath();
    }

    // -------------------------------------------------------------------------
    // Authorize
    // -------------------------------------------------------------------------

    @Override
    public Uni<URI> authorize(AuthorizeRequest request) {
        return Uni.createFrom().deferred(() -> {
            validateAuthorize(request);

            final var granted = scopes.grant(request.scope());
            final var authorizationKey = SecureTokens.randomHex();
            final var upstreamState = SecureTokens.randomHex();
            final var upstreamClientId = SecureTokens.randomUuid();

            final var pending = new PendingAuthorization(
                    request.clientId(),
                    request.redirectUri(),
                    request.codeChallenge(),
                    request.codeChallengeMethod(),
                    request.state(),
                    Scopes.format(granted),
                    upstreamState,
                    upstreamClientId);

            final Map<String, String> params = new LinkedHashMap<>();
            params.put("client_id", upstreamClientId);
            params.put("code_challenge", pkce.generateChallenge(request.codeChallenge()));
            params.put("code_challenge_method", PkceService.S256_METHOD);
            params.put("response_type", "code");
            params.put("redirect_uri", callbackUrl());
            params.put("state", authorizationKey + ":" + upstreamState);
            params.put("device_id", SecureTokens.randomUuid());
            params.put("target_site", config.upstream().siteName());
            params.put("device_name", redirectUris.deviceName(request.redirectUri(), request.state()));
            params.put("client_type", config.upstream().clientType());

            return pendingAuthorizations
                    .set(authorizationKey, pending, lifetimes.pendingAuthorizationTtl())
                    .map(ignored -> {
                        LOG.debugf(
                                "Pending authorization %s stored for client %s",
                                SecureTokens.abbreviate(authorizationKey),
                                request.clientId());
                        return withQuery(upstream.authorizationEndpoint(), params);
                    });
        });
    }

    private void validateAuthorize(AuthorizeRequest request) {
        requireParameter("client_id", request.clientId());
        requireParameter("redirect_uri", request.redirectUri());
        requireParameter("response_type", request.responseType());
        requireParameter("code_challenge", request.codeChallenge());
        requireParameter("code_challenge_method", request.codeChallengeMethod());

        if (!"code".equals(request.responseType())) {
            throw new OAuthException(
                    OAuthError.UNSUPPORTED_RESPONSE_TYPE, "Only the 'code' response type is supported");
        }
        if (!pkce.isValidChallengeMethod(request.codeChallengeMethod())) {
            throw OAuthException.invalidRequest("Only the S256 code_challenge_method is supported");
        }
        if (!redirectUris.isValid(request.redirectUri())) {
            throw OAuthException.invalidRequest(
                    "Invalid redirect URI: must use HTTPS, localhost HTTP, or custom scheme");
        }
    }

    // -------------------------------------------------------------------------
    // Callback
    // -------------------------------------------------------------------------

    @Override
    public Uni<URI> callback(CallbackRequest request) {
        return Uni.createFrom().deferred(() -> {
            if (request.error() != null && !request.error().isBlank()) {
                LOG.infof("Upstream authorization failed: %s", request.error());
                throw new OAuthException(OAuthError.ACCESS_DENIED, "User denied authorization");
            }
            requireParameter("code", request.code());
            requireParameter("state", request.state());

            final int separator = request.state().indexOf(':');
            if (separator < 0) {
                throw OAuthException.invalidRequest("Invalid state parameter");
            }
            final var authorizationKey = request.state().substring(0, separator);
            final var upstreamState = request.state().substring(separator + 1);

            return pendingAuthorizations.get(authorizationKey).flatMap(found -> {
                final var pending = found.filter(
                        p -> PkceService.constantTimeEquals(p.upstreamState(), upstreamState));
                if (pending.isEmpty()) {
                    throw OAuthException.invalidRequest("Invalid state parameter");
                }
                return completeCallback(authorizationKey, request.code(), pending.get());
            });
        });
    }

    private Uni<URI> completeCallback(String authorizationKey, String upstreamCode, PendingAuthorization pending) {
        return upstream.exchangeCode(upstreamCode, pending.codeChallenge(), callbackUrl(), pending.upstreamClientId())
                .flatMap(tokens -> upstream.currentUser(tokens).flatMap(user -> {
                    final var code = SecureTokens.randomHex();
                    final var ttl = lifetimes.authorizationCodeTtl();
                    final var record = new AuthorizationCode(
                            user,
                            upstream.serverUrl(),
                            tokens,
                            pending.clientId(),
                            pending.redirectUri(),
                            pending.codeChallenge(),
                            clock.instant().plus(ttl),
                            pending.upstreamClientId(),
                            pending.scope());
                    return authorizationCodes
                            .set(code, record, ttl)
                            .flatMap(ignored -> pendingAuthorizations.delete(authorizationKey))
                            .map(ignored -> {
                                LOG.debugf(
                                        "Issued authorization code %s to client %s for user %s",
                                        SecureTokens.abbreviate(code),
                                        pending.clientId(),
                                        user.name());
                                final Map<String, String> params = new LinkedHashMap<>();
                                params.put("code", code);
                                if (pending.state() != null) {
                                    params.put("state", pending.state());
                                }
                                return withQuery(pending.redirectUri(), params);
                            });
                }))
                .onFailure(UpstreamException.class)
                .transform(OAuthProvider::upstreamFailure);
    }

    private static OAuthException upstreamFailure(Throwable failure) {
        final var upstreamFailure = (UpstreamException) failure;
        if (upstreamFailure.isRejection()) {
            LOG.infof("Upstream rejected the authorization: %s", upstreamFailure.getMessage());
            return new OAuthException(OAuthError.INVALID_REQUEST, upstreamFailure.getMessage(), upstreamFailure);
        }
        LOG.errorf(upstreamFailure, "Upstream authorization failed");
        return OAuthException.serverError(
                "Internal server error during authorization. Contact your administrator.", upstreamFailure);
    }

    // -------------------------------------------------------------------------
    // Token
    // -------------------------------------------------------------------------

    @Override
    public Uni<TokenGrant> token(TokenRequest request) {
        final var grantType = request.grantType() == null ? "none" : request.grantType();
        return Uni.createFrom()
                .deferred(() -> {
                    requireParameter("grant_type", request.grantType());
                    return switch (request.grantType()) {
                        case AUTHORIZATION_CODE -> redeemCode(request);
                        case REFRESH_TOKEN -> redeemRefreshToken(request);
                        default -> throw new OAuthException(
                                OAuthError.UNSUPPORTED_GRANT_TYPE,
                                "Unsupported grant type: " + request.grantType());
                    };
                })
                .onFailure(failure -> !(failure instanceof OAuthException))
                .transform(failure -> {
                    LOG.errorf(failure, "Token request failed");
                    return OAuthException.serverError("Internal server error", failure);
                })
                .invoke(grant -> metrics.recordTokenGrant(grantType, "success"))
                .onFailure()
                .invoke(failure -> metrics.recordTokenGrant(
                        grantType, ((OAuthException) failure).getError().code()));
    }

    private Uni<TokenGrant> redeemCode(TokenRequest request) {
        requireParameter("code", request.code());
        requireParameter("code_verifier", request.codeVerifier());

        return authorizationCodes.consume(request.code()).flatMap(found -> {
            final var now = clock.instant();
            final var code = found.filter(c -> !c.isExpiredAt(now))
                    .orElseThrow(() -> OAuthException.invalidGrant("Invalid or expired authorization code"));

            if (request.clientId() != null && !request.clientId().equals(code.clientId())) {
                throw OAuthException.invalidGrant("Client ID mismatch");
            }
            if (request.redirectUri() != null && !request.redirectUri().equals(code.redirectUri())) {
                throw OAuthException.invalidGrant("Redirect URI mismatch");
            }
            if (!pkce.verify(request.codeVerifier(), code.codeChallenge())) {
                throw OAuthException.invalidGrant("Invalid code verifier");
            }

            final var granted = Scopes.parse(code.scope());
            final var issued =
                    accessTokens.issue(code.user(), code.upstreamServer(), code.tokens(), code.clientId(), granted);

            final var refreshTokenId = SecureTokens.randomHex();
            final var ttl = lifetimes.refreshTokenTtl();
            final var refreshData = new RefreshTokenData(
                    code.user(),
                    code.upstreamServer(),
                    code.tokens(),
                    code.clientId(),
                    now.plus(ttl),
                    code.upstreamClientId(),
                    code.scope());

            return refreshTokens.set(refreshTokenId, refreshData, ttl).map(ignored -> {
                LOG.debugf(
                        "Authorization code %s redeemed by client %s",
                        SecureTokens.abbreviate(request.code()),
                        code.clientId());
                return new TokenGrant(issued.token(), issued.expiresIn(), refreshTokenId, code.scope());
            });
        });
    }

    private Uni<TokenGrant> redeemRefreshToken(TokenRequest request) {
        requireParameter("refresh_token", request.refreshToken());
        final var refreshTokenId = request.refreshToken();

        return refreshTokens.get(refreshTokenId).flatMap(found -> {
            final var data = found.filter(d -> !d.isExpiredAt(clock.instant()))
                    .orElseThrow(() -> OAuthException.invalidGrant("Invalid or expired refresh token"));
            if (request.clientId() != null && !request.clientId().equals(data.clientId())) {
                throw OAuthException.invalidGrant("Client ID mismatch");
            }

            return refreshUpstreamIfDue(refreshTokenId, data).map(current -> {
                final var issued = accessTokens.issue(
                        current.user(),
                        current.upstreamServer(),
                        current.tokens(),
                        current.clientId(),
                        Scopes.parse(current.scope()));
                LOG.debugf(
                        "Refresh token %s redeemed by client %s",
                        SecureTokens.abbreviate(refreshTokenId),
                        current.clientId());
                return new TokenGrant(issued.token(), issued.expiresIn(), refreshTokenId, current.scope());
            });
        });
    }

    /**
     * Refresh the wrapped upstream credential when it expires within the refresh window.
     * An upstream failure keeps the stored credential.
     */
    private Uni<RefreshTokenData> refreshUpstreamIfDue(String refreshTokenId, RefreshTokenData data) {
        final var tokens = data.tokens();
        final var refreshAt = tokens.expiresAt().minus(config.upstreamRefreshWindow());
        if (tokens.refreshToken() == null || clock.instant().isBefore(refreshAt)) {
            return Uni.createFrom().item(data);
        }

        return upstream.refresh(tokens.refreshToken(), data.upstreamClientId())
                .map(Optional::of)
                .onFailure(UpstreamException.class)
                .recoverWithItem(failure -> {
                    LOG.warnf("Upstream credential refresh failed, reusing stored credential: %s",
                            failure.getMessage());
                    return Optional.<Tokens>empty();
                })
                .flatMap(refreshed -> {
                    if (refreshed.isEmpty()) {
                        return Uni.createFrom().item(data);
                    }
                    final var updated = data.withTokens(refreshed.get());
                    final var remaining = Duration.between(clock.instant(), data.expiresAt());
                    if (remaining.isNegative() || remaining.isZero()) {
                        return Uni.createFrom().item(updated);
                    }
                    return refreshTokens.set(refreshTokenId, updated, remaining).replaceWith(updated);
                });
    }

    // -------------------------------------------------------------------------
    // Registration
    // -------------------------------------------------------------------------

    @Override
    public ClientRegistration register(List<String> requested) {
        final List<String> validated = new ArrayList<>();
        if (requested != null) {
            for (final var uri : requested) {
                if (!redirectUris.isValid(uri)) {
                    throw new OAuthException(
                            OAuthError.INVALID_REDIRECT_URI,
                            "Invalid redirect URI: " + uri + ". Must use HTTPS, localhost HTTP, or custom scheme");
                }
                validated.add(uri);
            }
        }
        LOG.debugf("Registered public client with %d redirect URIs", validated.size());
        return new ClientRegistration(ClientRegistration.PUBLIC_CLIENT_ID, validated);
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static void requireParameter(String name, String value) {
        if (value == null || value.isBlank()) {
            throw OAuthException.invalidRequest("Missing required parameter: " + name);
        }
    }

    static URI withQuery(String base, Map<String, String> params) {
        final var query = params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        final var separator = base.contains("?") ? "&" : "?";
        return URI.create(base + separator + query);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
