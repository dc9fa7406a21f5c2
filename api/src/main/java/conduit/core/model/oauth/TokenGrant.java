package conduit.core.model.oauth;

/**
 * Successful token endpoint result.
 *
 * @param accessToken encrypted access token
 * @param expiresIn access token lifetime in seconds
 * @param refreshToken refresh token id
 * @param scope granted scopes, space separated
 */
public record TokenGrant(String accessToken, long expiresIn, String refreshToken, String scope) {

    public static final String TOKEN_TYPE = "Bearer";
}
