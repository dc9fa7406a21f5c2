package conduit.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RFC 6749 error body.
 *
 * @param error error code, e.g. {@code invalid_grant}
 * @param errorDescription human readable description
 */
public record OAuthErrorResponse(
        @JsonProperty("error") String error, @JsonProperty("error_description") String errorDescription) {}
