package conduit.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import conduit.core.model.oauth.TokenGrant;

/**
 * Token endpoint success body.
 */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("scope") String scope) {

    public static TokenResponse from(TokenGrant grant) {
        return new TokenResponse(
                grant.accessToken(), TokenGrant.TOKEN_TYPE, grant.expiresIn(), grant.refreshToken(), grant.scope());
    }
}
