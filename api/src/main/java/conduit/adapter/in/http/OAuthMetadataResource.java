package conduit.adapter.in.http;

import java.util.List;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import conduit.adapter.in.dto.AuthorizationServerMetadata;
import conduit.adapter.in.dto.ProtectedResourceMetadata;
import conduit.core.config.OAuthConfig;
import conduit.core.service.scope.ScopeRegistry;

/**
 * OAuth discovery documents.
 */
@Path("/.well-known")
@Produces(MediaType.APPLICATION_JSON)
public class OAuthMetadataResource {

    private final OAuthConfig config;
    private final ScopeRegistry scopes;

    @Inject
    public OAuthMetadataResource(OAuthConfig config, ScopeRegistry scopes) {
        this.config = config;
        this.scopes = scopes;
    }

    @GET
    @Path("/oauth-authorization-server")
    public AuthorizationServerMetadata authorizationServer() {
        return AuthorizationServerMetadata.forIssuer(config.issuer(), scopes.supportedScopes());
    }

    @GET
    @Path("/oauth-protected-resource")
    public ProtectedResourceMetadata protectedResource() {
        return new ProtectedResourceMetadata(
                config.issuer() + config.resourcePath(),
                List.of(config.issuer()),
                List.of("header"),
                scopes.advertisedResourceScopes());
    }
}
