package conduit.adapter.in.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Dynamic client registration request. Only the redirect URIs are used.
 *
 * @param redirectUris requested redirect URIs
 */
public record ClientRegistrationRequest(@JsonProperty("redirect_uris") List<String> redirectUris) {}
