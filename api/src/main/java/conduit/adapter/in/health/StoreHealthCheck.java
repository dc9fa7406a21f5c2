package conduit.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import conduit.adapter.out.storage.StoreContext;

/**
 * Readiness check probing every store backend.
 *
 * <p>DOWN if any store's health check reports false.
 */
@Readiness
@ApplicationScoped
public class StoreHealthCheck implements AsyncHealthCheck {

    private final StoreContext stores;

    @Inject
    public StoreHealthCheck(StoreContext stores) {
        this.stores = stores;
    }

    @Override
    public Uni<HealthCheckResponse> call() {
        return stores.healthChecks().map(results -> {
            final var builder = HealthCheckResponse.named("stores").withData("type", stores.storeType().name());
            results.forEach((name, healthy) -> builder.withData(name, healthy.booleanValue()));
            return builder.status(results.values().stream().allMatch(Boolean::booleanValue)).build();
        });
    }
}
