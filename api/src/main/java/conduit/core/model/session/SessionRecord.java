package conduit.core.model.session;

import java.util.Objects;

import conduit.core.model.auth.AuthContext;

/**
 * Durable part of a protocol session.
 *
 * <p>The live transport is process-local and never persisted; only the id, the client details
 * and the owner survive a restart. The owner is the token subject and OAuth client that opened
 * the session.
 */
public record SessionRecord(String sessionId, ClientInfo clientInfo, String subject, String clientId) {

    public static SessionRecord openedBy(String sessionId, ClientInfo clientInfo, AuthContext auth) {
        return new SessionRecord(sessionId, clientInfo, auth.subject(), auth.claims().clientId());
    }

    /**
     * Whether the caller presents a token for the same subject and client that opened the session.
     */
    public boolean isOwnedBy(AuthContext auth) {
        return auth != null
                && Objects.equals(subject, auth.subject())
                && Objects.equals(clientId, auth.claims().clientId());
    }
}
