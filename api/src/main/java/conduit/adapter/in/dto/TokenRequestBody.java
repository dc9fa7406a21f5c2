package conduit.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import conduit.core.model.oauth.TokenRequest;

/**
 * Token endpoint request sent as JSON instead of a form.
 */
public record TokenRequestBody(
        @JsonProperty("grant_type") String grantType,
        @JsonProperty("code") String code,
        @JsonProperty("code_verifier") String codeVerifier,
        @JsonProperty("redirect_uri") String redirectUri,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("refresh_token") String refreshToken) {

    public TokenRequest toTokenRequest() {
        return new TokenRequest(grantType, code, codeVerifier, redirectUri, clientId, refreshToken);
    }
}
