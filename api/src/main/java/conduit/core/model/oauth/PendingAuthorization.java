package conduit.core.model.oauth;

/**
 * An authorization request waiting for the upstream login to call back.
 *
 * <p>Keyed by a server-generated authorization key and removed once the callback succeeds.
 *
 * @param clientId client that started the flow
 * @param redirectUri where the client expects the authorization code
 * @param codeChallenge the client's S256 PKCE challenge
 * @param codeChallengeMethod always {@code S256}
 * @param state opaque client state echoed back on redirect, may be null
 * @param scope granted scopes, space separated
 * @param upstreamState random value bound into the upstream {@code state}
 * @param upstreamClientId client id presented to the upstream platform
 */
public record PendingAuthorization(
        String clientId,
        String redirectUri,
        String codeChallenge,
        String codeChallengeMethod,
        String state,
        String scope,
        String upstreamState,
        String upstreamClientId) {}
