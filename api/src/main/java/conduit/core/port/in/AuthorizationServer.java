package conduit.core.port.in;

import java.net.URI;
import java.util.List;

import io.smallrye.mutiny.Uni;

import conduit.core.model.oauth.AuthorizeRequest;
import conduit.core.model.oauth.CallbackRequest;
import conduit.core.model.oauth.ClientRegistration;
import conduit.core.model.oauth.TokenGrant;
import conduit.core.model.oauth.TokenRequest;

/**
 * Port for the OAuth 2.1 authorization server that federates login to the upstream platform.
 *
 * <p>Every operation fails with {@link conduit.core.model.oauth.OAuthException} when the request
 * is rejected.
 */
public interface AuthorizationServer {

    /**
     * Start an authorization: validate the client request, remember it, and send the
     * browser to the upstream login.
     *
     * @param request authorization request parameters
     * @return Uni with the upstream authorization URL to redirect to
     */
    Uni<URI> authorize(AuthorizeRequest request);

    /**
     * Complete the upstream login: exchange the upstream code, resolve the user and issue
     * an authorization code to the client.
     *
     * @param request callback parameters
     * @return Uni with the client redirect URL carrying {@code code} and {@code state}
     */
    Uni<URI> callback(CallbackRequest request);

    /**
     * Token endpoint: redeem an authorization code or a refresh token.
     *
     * @param request token request parameters
     * @return Uni with the token response
     */
    Uni<TokenGrant> token(TokenRequest request);

    /**
     * Dynamic client registration for public clients.
     *
     * @param redirectUris the requested redirect URIs
     * @return the registration
     */
    ClientRegistration register(List<String> redirectUris);
}
