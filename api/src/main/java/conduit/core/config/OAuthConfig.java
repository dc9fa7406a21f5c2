package conduit.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the OAuth authorization and resource server.
 *
 * <p>Configuration prefix: {@code conduit.oauth}
 *
 * <p>Lifetimes outside their supported range are clamped by {@link OAuthLifetimes}.
 */
@ConfigMapping(prefix = "conduit.oauth")
public interface OAuthConfig {

    /**
     * Public base URL of this server. Used as the token issuer and to build
     * endpoint URLs in discovery metadata.
     *
     * @return issuer URL (default: http://localhost:8080)
     */
    @WithDefault("http://localhost:8080")
    String issuer();

    /**
     * Path of the protected protocol endpoint. Issuer plus this path is the token audience.
     *
     * @return resource path (default: /mcp)
     */
    @WithDefault("/mcp")
    String resourcePath();

    /**
     * Path the upstream platform redirects back to after login.
     *
     * @return callback path (default: /oauth/callback)
     */
    @WithDefault("/oauth/callback")
    String callbackPath();

    /**
     * How long a pending authorization waits for the upstream callback.
     *
     * @return pending authorization TTL (default: 10 minutes, range 1-10 minutes)
     */
    @WithDefault("PT10M")
    Duration pendingAuthorizationTtl();

    /**
     * How long an issued authorization code can be redeemed.
     *
     * @return authorization code TTL (default: 10 minutes, range 1-10 minutes)
     */
    @WithDefault("PT10M")
    Duration authorizationCodeTtl();

    /**
     * Access token lifetime. Never exceeds the wrapped upstream credential's lifetime.
     *
     * @return access token TTL (default: 1 hour, range 5 minutes-24 hours)
     */
    @WithDefault("PT1H")
    Duration accessTokenTtl();

    /**
     * Refresh token lifetime.
     *
     * @return refresh token TTL (default: 30 days, range 1 hour-90 days)
     */
    @WithDefault("P30D")
    Duration refreshTokenTtl();

    /**
     * On a refresh grant, the upstream credential is refreshed first when it expires
     * within this window.
     *
     * @return upstream refresh window (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration upstreamRefreshWindow();

    /**
     * Enforce per-operation scopes on the protocol endpoint.
     *
     * @return true if scopes are enforced (default: true)
     */
    @WithDefault("true")
    boolean enforceScopes();

    /**
     * Advertise upstream platform scopes in the protected-resource metadata.
     *
     * @return true to advertise upstream scopes (default: false)
     */
    @WithDefault("false")
    boolean advertiseUpstreamScopes();

    /**
     * Access token encryption keys.
     */
    TokenConfig token();

    /**
     * Upstream platform settings.
     */
    UpstreamConfig upstream();

    /**
     * Access token encryption settings.
     */
    interface TokenConfig {

        /**
         * Base64-encoded 256-bit key. When set, tokens use direct AES-256-GCM encryption.
         *
         * @return symmetric key
         */
        Optional<String> secret();

        /**
         * RSA private key as a JSON Web Key. Used with RSA-OAEP-256 when no symmetric key is set.
         * When neither is set an ephemeral key is generated at startup.
         *
         * @return RSA JWK JSON
         */
        Optional<String> rsaJwk();
    }

    /**
     * Upstream platform settings.
     */
    interface UpstreamConfig {

        /**
         * Base URL of the upstream platform.
         *
         * @return server URL (default: https://online.tableau.com)
         */
        @WithDefault("https://online.tableau.com")
        String serverUrl();

        /**
         * Site the user signs in to, forwarded as {@code target_site}.
         *
         * @return site name (default: empty, the default site)
         */
        @WithDefault("")
        String siteName();

        /**
         * @return authorization endpoint path (default: /oauth2/v1/auth)
         */
        @WithDefault("/oauth2/v1/auth")
        String authorizationPath();

        /**
         * @return token endpoint path (default: /oauth2/v1/token)
         */
        @WithDefault("/oauth2/v1/token")
        String tokenPath();

        /**
         * REST API version used for the current-session lookup.
         *
         * @return API version (default: 3.24)
         */
        @WithDefault("3.24")
        String apiVersion();

        /**
         * Client type forwarded on the upstream authorization request.
         *
         * @return client type (default: conduit)
         */
        @WithDefault("conduit")
        String clientType();

        /**
         * Timeout for upstream HTTP calls.
         *
         * @return timeout (default: 10 seconds)
         */
        @WithDefault("PT10S")
        Duration timeout();
    }
}
