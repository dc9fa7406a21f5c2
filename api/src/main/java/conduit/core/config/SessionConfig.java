package conduit.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for protocol sessions.
 *
 * <p>Configuration prefix: {@code conduit.session}
 */
@ConfigMapping(prefix = "conduit.session")
public interface SessionConfig {

    /**
     * How long a session record is kept after it was created.
     *
     * @return session TTL (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration ttl();

    /**
     * Maximum attempts to generate a non-colliding session id.
     *
     * @return max attempts (default: 3)
     */
    @WithDefault("3")
    int maxIdAttempts();
}
