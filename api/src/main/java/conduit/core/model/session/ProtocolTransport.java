package conduit.core.model.session;

import io.smallrye.mutiny.Uni;

import conduit.core.model.auth.AuthContext;

/**
 * Process-local, long-lived channel for one protocol session.
 */
public interface ProtocolTransport {

    /**
     * Session id bound to this transport.
     */
    String sessionId();

    /**
     * Handle a JSON-RPC message (single request or batch).
     *
     * @param body raw request body
     * @param auth authenticated caller
     * @return JSON response body, empty when every message was a notification
     */
    Uni<String> handle(String body, AuthContext auth);

    /**
     * Register a hook invoked exactly once when the transport closes.
     */
    void onClose(Runnable hook);

    /**
     * Close the transport and run the close hooks.
     */
    void close();

    boolean isOpen();
}
