package conduit.core.model.auth;

/**
 * The parts of a protocol request needed to authenticate and authorize it.
 *
 * @param method HTTP method
 * @param authorization {@code Authorization} header, may be null
 * @param accept {@code Accept} header, may be null
 * @param baseUrl public base URL of this server, used in challenges
 * @param body raw request body, may be null or empty for GET and DELETE
 */
public record ResourceRequest(String method, String authorization, String accept, String baseUrl, String body) {}
