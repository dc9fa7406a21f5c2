package conduit.core.model.oauth;

import java.util.List;

/**
 * Result of a dynamic client registration.
 *
 * <p>Every client is registered as the same public client; the only per-client data echoed back
 * is the validated list of redirect URIs.
 */
public record ClientRegistration(String clientId, List<String> redirectUris) {

    public static final String PUBLIC_CLIENT_ID = "mcp-public-client";

    public ClientRegistration {
        redirectUris = redirectUris == null ? List.of() : List.copyOf(redirectUris);
    }
}
