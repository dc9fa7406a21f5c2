package conduit.core.model.oauth;

/**
 * Query parameters of an authorization request.
 */
public record AuthorizeRequest(
        String clientId,
        String redirectUri,
        String responseType,
        String codeChallenge,
        String codeChallengeMethod,
        String state,
        String scope) {}
