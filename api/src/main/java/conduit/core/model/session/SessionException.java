package conduit.core.model.session;

/**
 * A protocol request could not be matched to a usable session.
 */
public class SessionException extends RuntimeException {

    private final int status;

    public SessionException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    public static SessionException badRequest(String message) {
        return new SessionException(400, message);
    }

    public static SessionException notFound() {
        return new SessionException(404, "Session not found");
    }
}
