package conduit.core.config;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

/**
 * Effective OAuth lifetimes, clamped to their supported ranges.
 */
@ApplicationScoped
public class OAuthLifetimes {

    private static final Logger LOG = Logger.getLogger(OAuthLifetimes.class);

    static final Duration MIN_CODE_TTL = Duration.ofMinutes(1);
    static final Duration MAX_CODE_TTL = Duration.ofMinutes(10);
    static final Duration MIN_ACCESS_TTL = Duration.ofMinutes(5);
    static final Duration MAX_ACCESS_TTL = Duration.ofHours(24);
    static final Duration MIN_REFRESH_TTL = Duration.ofHours(1);
    static final Duration MAX_REFRESH_TTL = Duration.ofDays(90);

    private final Duration pendingAuthorizationTtl;
    private final Duration authorizationCodeTtl;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;

    @Inject
    public OAuthLifetimes(OAuthConfig config) {
        this(
                config.pendingAuthorizationTtl(),
                config.authorizationCodeTtl(),
                config.accessTokenTtl(),
                config.refreshTokenTtl());
    }

    public OAuthLifetimes(Duration pending, Duration code, Duration access, Duration refresh) {
        this.pendingAuthorizationTtl = clamp("pending-authorization-ttl", pending, MIN_CODE_TTL, MAX_CODE_TTL);
        this.authorizationCodeTtl = clamp("authorization-code-ttl", code, MIN_CODE_TTL, MAX_CODE_TTL);
        this.accessTokenTtl = clamp("access-token-ttl", access, MIN_ACCESS_TTL, MAX_ACCESS_TTL);
        this.refreshTokenTtl = clamp("refresh-token-ttl", refresh, MIN_REFRESH_TTL, MAX_REFRESH_TTL);
    }

    public static OAuthLifetimes defaults() {
        return new OAuthLifetimes(
                Duration.ofMinutes(10), Duration.ofMinutes(10), Duration.ofHours(1), Duration.ofDays(30));
    }

    public Duration pendingAuthorizationTtl() {
        return pendingAuthorizationTtl;
    }

    public Duration authorizationCodeTtl() {
        return authorizationCodeTtl;
    }

    public Duration accessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration refreshTokenTtl() {
        return refreshTokenTtl;
    }

    static Duration clamp(String name, Duration value, Duration min, Duration max) {
        if (value.compareTo(min) < 0) {
            LOG.warnf("conduit.oauth.%s=%s is below the minimum, using %s", name, value, min);
            return min;
        }
        if (value.compareTo(max) > 0) {
            LOG.warnf("conduit.oauth.%s=%s is above the maximum, using %s", name, value, max);
            return max;
        }
        return value;
    }
}
