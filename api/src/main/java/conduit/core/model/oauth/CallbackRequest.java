package conduit.core.model.oauth;

/**
 * Query parameters delivered by the upstream platform to the callback endpoint.
 *
 * @param code upstream authorization code
 * @param state {@code authorizationKey:upstreamState}
 * @param error upstream error code, set when the user denied or the login failed
 * @param errorDescription optional upstream error description
 */
public record CallbackRequest(String code, String state, String error, String errorDescription) {}
