package conduit.core.port.in;

import io.smallrye.mutiny.Uni;

import conduit.core.model.auth.AuthContext;
import conduit.core.model.session.ProtocolResponse;

/**
 * Port for routing protocol messages to their sessions.
 *
 * <p>Failures that concern the session itself (missing, malformed or unknown id) are reported
 * as {@link conduit.core.model.session.SessionException}. A session opened by another subject
 * or client is reported as unknown.
 */
public interface SessionManagement {

    /**
     * Handle a JSON-RPC message. An {@code initialize} without a session id opens a new session.
     *
     * @param sessionId the {@code mcp-session-id} header, may be null
     * @param body raw JSON-RPC body
     * @param auth the authenticated caller
     * @return Uni with the response and the session it belongs to
     */
    Uni<ProtocolResponse> handle(String sessionId, String body, AuthContext auth);

    /**
     * Check that a session exists and is usable from this process.
     *
     * @param sessionId the {@code mcp-session-id} header
     * @param auth the authenticated caller
     * @return Uni completing when the session is live
     */
    Uni<Void> require(String sessionId, AuthContext auth);

    /**
     * Terminate a session, closing its transport and deleting its record.
     *
     * @param sessionId the {@code mcp-session-id} header
     * @param auth the authenticated caller
     * @return Uni completing when the record is deleted
     */
    Uni<Void> terminate(String sessionId, AuthContext auth);
}
