package conduit.adapter.in.http;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import conduit.adapter.in.dto.ClientRegistrationRequest;
import conduit.adapter.in.dto.ClientRegistrationResponse;
import conduit.adapter.in.dto.TokenRequestBody;
import conduit.adapter.in.dto.TokenResponse;
import conduit.core.model.oauth.AuthorizeRequest;
import conduit.core.model.oauth.CallbackRequest;
import conduit.core.model.oauth.TokenRequest;
import conduit.core.port.in.AuthorizationServer;

/**
 * OAuth 2.1 authorization server endpoints.
 *
 * <p>Errors surface as {@link conduit.core.model.oauth.OAuthException} and are rendered by
 * {@link conduit.adapter.in.problem.ExceptionMappers}.
 */
@Path("/oauth")
@Produces(MediaType.APPLICATION_JSON)
public class OAuthResource {

    private final AuthorizationServer authorizationServer;

    @Inject
    public OAuthResource(AuthorizationServer authorizationServer) {
        this.authorizationServer = authorizationServer;
    }

    /**
     * Start an authorization and redirect to the upstream login.
     */
    @GET
    @Path("/authorize")
    public Uni<Response> authorize(
            @QueryParam("client_id") String clientId,
            @QueryParam("redirect_uri") String redirectUri,
            @QueryParam("response_type") String responseType,
            @QueryParam("code_challenge") String codeChallenge,
            @QueryParam("code_challenge_method") String codeChallengeMethod,
            @QueryParam("state") String state,
            @QueryParam("scope") String scope) {
        final var request = new AuthorizeRequest(
                clientId, redirectUri, responseType, codeChallenge, codeChallengeMethod, state, scope);
        return authorizationServer.authorize(request).map(location -> Response.status(Response.Status.FOUND)
                .location(location)
                .build());
    }

    /**
     * Upstream login completion; redirects back to the client with an authorization code.
     */
    @GET
    @Path("/callback")
    public Uni<Response> callback(
            @QueryParam("code") String code,
            @QueryParam("state") String state,
            @QueryParam("error") String error,
            @QueryParam("error_description") String errorDescription) {
        return authorizationServer
                .callback(new CallbackRequest(code, state, error, errorDescription))
                .map(location -> Response.status(Response.Status.FOUND)
                        .location(location)
                        .build());
    }

    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<Response> tokenForm(
            @FormParam("grant_type") String grantType,
            @FormParam("code") String code,
            @FormParam("code_verifier") String codeVerifier,
            @FormParam("redirect_uri") String redirectUri,
            @FormParam("client_id") String clientId,
            @FormParam("refresh_token") String refreshToken) {
        return token(new TokenRequest(grantType, code, codeVerifier, redirectUri, clientId, refreshToken));
    }

    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> tokenJson(TokenRequestBody body) {
        final var request = body == null
                ? new TokenRequest(null, null, null, null, null, null)
                : body.toTokenRequest();
        return token(request);
    }

    private Uni<Response> token(TokenRequest request) {
        return authorizationServer.token(request).map(grant -> Response.ok(TokenResponse.from(grant))
                .header("Cache-Control", "no-store")
                .header("Pragma", "no-cache")
                .build());
    }

    /**
     * Dynamic client registration. Every client shares the public client id.
     */
    @POST
    @Path("/register")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response register(ClientRegistrationRequest request) {
        final var registration =
                authorizationServer.register(request == null ? null : request.redirectUris());
        return Response.status(Response.Status.CREATED)
                .entity(ClientRegistrationResponse.from(registration))
                .build();
    }
}
