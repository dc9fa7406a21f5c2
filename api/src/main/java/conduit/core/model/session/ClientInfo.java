package conduit.core.model.session;

/**
 * Client implementation details sent in the protocol {@code initialize} request.
 */
public record ClientInfo(String name, String version) {

    public static ClientInfo unknown() {
        return new ClientInfo("unknown", "unknown");
    }
}
