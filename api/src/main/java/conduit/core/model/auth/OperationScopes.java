package conduit.core.model.auth;

import java.util.Set;

/**
 * Scopes a protocol operation requires.
 *
 * @param gateway scopes in the gateway's own namespace
 * @param upstream scopes the upstream platform API calls need
 */
public record OperationScopes(Set<String> gateway, Set<String> upstream) {

    public OperationScopes {
        gateway = gateway == null ? Set.of() : Set.copyOf(gateway);
        upstream = upstream == null ? Set.of() : Set.copyOf(upstream);
    }

    public static OperationScopes none() {
        return new OperationScopes(Set.of(), Set.of());
    }
}
