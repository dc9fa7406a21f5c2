package conduit.core.service.oauth;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Redirect URI rules for public clients.
 *
 * <p>Allowed: any {@code https} URI, {@code http} only on a loopback host, and native-app
 * custom schemes (e.g. {@code cursor://}). Fragments are never allowed.
 */
@ApplicationScoped
public class RedirectUriValidator {

    private static final Pattern CUSTOM_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*$");
    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "[::1]", "::1");
    private static final Set<String> FORBIDDEN_SCHEMES = Set.of("javascript", "data", "file", "vbscript");

    /**
     * Check whether a redirect URI is acceptable.
     *
     * @param redirectUri the URI
     * @return true if allowed
     */
    public boolean isValid(String redirectUri) {
        if (redirectUri == null || redirectUri.isBlank()) {
            return false;
        }
        final URI uri;
        try {
            uri = new URI(redirectUri);
        } catch (URISyntaxException e) {
            return false;
        }
        final var scheme = uri.getScheme();
        if (scheme == null || uri.getRawFragment() != null) {
            return false;
        }

        final var normalized = scheme.toLowerCase(Locale.ROOT);
        if ("https".equals(normalized)) {
            return uri.getHost() != null;
        }
        if ("http".equals(normalized)) {
            return uri.getHost() != null && LOOPBACK_HOSTS.contains(uri.getHost().toLowerCase(Locale.ROOT));
        }
        return CUSTOM_SCHEME.matcher(scheme).matches() && !FORBIDDEN_SCHEMES.contains(normalized);
    }

    /**
     * Device name shown by the upstream platform for the authorizing client.
     *
     * @param redirectUri the client's redirect URI
     * @param state the client's state parameter, may be null
     * @return a label such as {@code conduit (Cursor)}
     */
    public String deviceName(String redirectUri, String state) {
        final var unknown = "conduit (Unknown agent)";
        try {
            final var scheme = new URI(redirectUri).getScheme();
            if (scheme == null) {
                return unknown;
            }
            if ("https".equalsIgnoreCase(scheme) || "http".equalsIgnoreCase(scheme)) {
                if ("https://vscode.dev/redirect".equals(redirectUri) && isVsCodeState(state)) {
                    return "conduit (VS Code)";
                }
                return unknown;
            }
            if ("cursor".equalsIgnoreCase(scheme)) {
                return "conduit (Cursor)";
            }
            return "conduit (" + scheme + ")";
        } catch (URISyntaxException e) {
            return unknown;
        }
    }

    private static boolean isVsCodeState(String state) {
        if (state == null) {
            return false;
        }
        try {
            return "vscode".equalsIgnoreCase(new URI(state).getScheme());
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
