package conduit.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import conduit.adapter.in.dto.OAuthErrorResponse;
import conduit.core.model.oauth.OAuthError;
import conduit.core.model.oauth.OAuthException;
import conduit.core.model.session.SessionException;
import conduit.core.model.storage.StoreException;

/**
 * Maps exceptions to responses.
 *
 * <p>OAuth failures use the RFC 6749 {@code {error, error_description}} body; everything else
 * is an RFC 7807 problem.
 */
@ApplicationScoped
public class ExceptionMappers {

    private static final Logger LOG = Logger.getLogger(ExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapOAuthException(OAuthException e) {
        if (e.getError() == OAuthError.SERVER_ERROR) {
            LOG.errorv(e.getCause(), "OAuth server error: {0}", e.getDescription());
        } else {
            LOG.debugv("OAuth error {0}: {1}", e.getError().code(), e.getDescription());
        }
        return oauthError(e.getError(), e.getDescription());
    }

    @ServerExceptionMapper
    public Response mapStoreException(StoreException e) {
        LOG.errorv(e, "Store operation failed: {0}", e.getMessage());
        return oauthError(OAuthError.SERVER_ERROR, "Internal server error");
    }

    @ServerExceptionMapper
    public Response mapSessionException(SessionException e) {
        LOG.debugv("Session error: {0}", e.getMessage());
        return toResponse(ProtocolProblem.of(e.getStatus(), e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(ProtocolProblem.badRequest(e.getMessage()));
    }

    static Response oauthError(OAuthError error, String description) {
        return Response.status(error.status())
                .type(MediaType.APPLICATION_JSON)
                .header("Cache-Control", "no-store")
                .header("Pragma", "no-cache")
                .entity(new OAuthErrorResponse(error.code(), description))
                .build();
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
