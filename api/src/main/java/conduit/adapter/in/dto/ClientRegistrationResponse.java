package conduit.adapter.in.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import conduit.core.model.oauth.ClientRegistration;

/**
 * Dynamic client registration response for a public native client.
 */
public record ClientRegistrationResponse(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("redirect_uris") List<String> redirectUris,
        @JsonProperty("grant_types") List<String> grantTypes,
        @JsonProperty("response_types") List<String> responseTypes,
        @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
        @JsonProperty("application_type") String applicationType) {

    public static ClientRegistrationResponse from(ClientRegistration registration) {
        return new ClientRegistrationResponse(
                registration.clientId(),
                registration.redirectUris(),
                List.of("authorization_code", "refresh_token"),
                List.of("code"),
                "none",
                "native");
    }
}
