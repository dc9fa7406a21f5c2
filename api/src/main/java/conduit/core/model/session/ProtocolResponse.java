package conduit.core.model.session;

/**
 * Result of handling a protocol message.
 *
 * @param sessionId session the message was handled in, sent back as {@code mcp-session-id}
 * @param body JSON-RPC response body, empty when the request held only notifications
 */
public record ProtocolResponse(String sessionId, String body) {

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }
}
