package conduit.core.model.oauth;

/**
 * Parameters of a token endpoint request.
 */
public record TokenRequest(
        String grantType,
        String code,
        String codeVerifier,
        String redirectUri,
        String clientId,
        String refreshToken) {

    public static TokenRequest authorizationCode(String code, String codeVerifier, String redirectUri, String clientId) {
        return new TokenRequest("authorization_code", code, codeVerifier, redirectUri, clientId, null);
    }

    public static TokenRequest refresh(String refreshToken, String clientId) {
        return new TokenRequest("refresh_token", null, null, null, clientId, refreshToken);
    }
}
