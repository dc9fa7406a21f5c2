package conduit.core.model.oauth;

/**
 * Identity of the signed-in upstream platform user.
 *
 * @param id upstream user id
 * @param name upstream user name, used as the token subject
 */
public record UpstreamUser(String id, String name) {

    public UpstreamUser {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
