package conduit.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import conduit.core.port.out.Metrics;

/**
 * Central service for recording gateway metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code conduit.store.timeouts.total} - Store operations that exceeded their timeout</li>
 *   <li>{@code conduit.store.failures.total} - Store operations that failed</li>
 *   <li>{@code conduit.oauth.token.grants.total} - Token endpoint outcomes by grant type</li>
 *   <li>{@code conduit.auth.denied.total} - Protocol requests rejected by the auth middleware</li>
 * </ul>
 */
@ApplicationScoped
public class ConduitMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public ConduitMetrics(
            MeterRegistry registry, @ConfigProperty(name = "conduit.metrics.enabled", defaultValue = "true") boolean enabled) {
        this.registry = registry;
        this.enabled = enabled && registry != null;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordStoreTimeout(String store, String operation) {
        if (!enabled) {
            return;
        }
        Counter.builder("conduit.store.timeouts.total")
                .description("Store operations that exceeded their timeout")
                .tag("store", store)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String store, String operation) {
        if (!enabled) {
            return;
        }
        Counter.builder("conduit.store.failures.total")
                .description("Store operations that failed")
                .tag("store", store)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordTokenGrant(String grantType, String outcome) {
        if (!enabled) {
            return;
        }
        Counter.builder("conduit.oauth.token.grants.total")
                .description("Token endpoint outcomes")
                .tag("grant_type", grantType == null ? "none" : grantType)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuthDenied(String error) {
        if (!enabled) {
            return;
        }
        Counter.builder("conduit.auth.denied.total")
                .description("Protocol requests rejected by bearer authentication")
                .tag("error", error)
                .register(registry)
                .increment();
    }
}
