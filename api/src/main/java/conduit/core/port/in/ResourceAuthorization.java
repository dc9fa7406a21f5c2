package conduit.core.port.in;

import conduit.core.model.auth.AuthDecision;
import conduit.core.model.auth.ResourceRequest;

/**
 * Port for guarding the protocol endpoint with bearer tokens and per-operation scopes.
 */
public interface ResourceAuthorization {

    /**
     * Authenticate the caller and check the scopes the requested operations need.
     *
     * @param request the protocol request
     * @return {@link AuthDecision.Allowed} or a {@link AuthDecision.Denied} carrying the
     *         status, error and {@code WWW-Authenticate} challenge to send
     */
    AuthDecision authorize(ResourceRequest request);
}
