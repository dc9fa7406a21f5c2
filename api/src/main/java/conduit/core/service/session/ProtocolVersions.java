package conduit.core.service.session;

import java.util.List;

/**
 * Protocol revisions this server speaks, newest first.
 */
public final class ProtocolVersions {

    public static final String LATEST = "2025-06-18";
    public static final List<String> SUPPORTED = List.of(LATEST, "2025-03-26", "2024-11-05");

    /** Revision assumed when a client sends no version header. */
    public static final String DEFAULT_NEGOTIATED = "2025-03-26";

    private ProtocolVersions() {
        // Utility class - prevent instantiation
    }

    public static boolean isSupported(String version) {
        return SUPPORTED.contains(version);
    }

    /**
     * Version to answer an {@code initialize} with: the client's if supported, else the latest.
     */
    public static String negotiate(String requested) {
        return isSupported(requested) ? requested : LATEST;
    }
}
