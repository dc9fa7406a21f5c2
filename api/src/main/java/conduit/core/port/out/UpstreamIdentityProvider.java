package conduit.core.port.out;

import io.smallrye.mutiny.Uni;

import conduit.core.model.oauth.Tokens;
import conduit.core.model.oauth.UpstreamException;
import conduit.core.model.oauth.UpstreamUser;

/**
 * Port to the third-party analytics platform's OAuth and session APIs.
 */
public interface UpstreamIdentityProvider {

    /**
     * Base URL of the upstream platform, recorded in issued tokens.
     */
    String serverUrl();

    /**
     * URL of the upstream authorization endpoint the browser is redirected to.
     */
    String authorizationEndpoint();

    /**
     * Exchange an upstream authorization code for a credential pair.
     *
     * @param code upstream authorization code
     * @param codeVerifier PKCE verifier matching the challenge sent upstream
     * @param redirectUri the callback URI used in the authorization request
     * @param clientId client id presented upstream
     * @return the credential pair; fails with {@link UpstreamException} on rejection
     */
    Uni<Tokens> exchangeCode(String code, String codeVerifier, String redirectUri, String clientId);

    /**
     * Refresh an upstream credential pair.
     *
     * @param refreshToken upstream refresh token
     * @param clientId client id presented upstream
     * @return the new credential pair
     */
    Uni<Tokens> refresh(String refreshToken, String clientId);

    /**
     * Fetch the user owning a credential.
     *
     * @param tokens the credential pair
     * @return the user identity
     */
    Uni<UpstreamUser> currentUser(Tokens tokens);
}
