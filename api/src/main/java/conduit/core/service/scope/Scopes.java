package conduit.core.service.scope;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * RFC 6749 scope string utilities.
 */
public final class Scopes {

    private Scopes() {
        // Utility class - prevent instantiation
    }

    /**
     * Split a space-separated scope string, dropping blanks and duplicates.
     *
     * @param scope the scope parameter, may be null
     * @return scopes in first-seen order
     */
    public static Set<String> parse(String scope) {
        final var scopes = new LinkedHashSet<String>();
        if (scope == null || scope.isBlank()) {
            return scopes;
        }
        for (String token : scope.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                scopes.add(token);
            }
        }
        return scopes;
    }

    /**
     * Join scopes with single spaces.
     */
    public static String format(Collection<String> scopes) {
        return String.join(" ", scopes);
    }

    /**
     * Requested scopes that are supported.
     *
     * @param requested requested scopes
     * @param supported supported scopes
     * @return the supported subset, preserving request order
     */
    public static Set<String> supportedSubset(Collection<String> requested, Collection<String> supported) {
        final var subset = new LinkedHashSet<String>();
        for (String scope : requested) {
            if (supported.contains(scope)) {
                subset.add(scope);
            }
        }
        return subset;
    }
}
