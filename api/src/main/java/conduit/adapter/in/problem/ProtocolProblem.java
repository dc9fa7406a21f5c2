package conduit.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 problems for protocol endpoint failures that are not OAuth errors.
 */
public final class ProtocolProblem {

    private ProtocolProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem sessionNotFound(String detail) {
        return HttpProblem.builder()
                .withTitle("Session Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem methodNotAllowed(String detail) {
        return HttpProblem.builder()
                .withTitle("Method Not Allowed")
                .withStatus(Status.METHOD_NOT_ALLOWED)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem of(int status, String detail) {
        return switch (status) {
            case 400 -> badRequest(detail);
            case 404 -> sessionNotFound(detail);
            case 405 -> methodNotAllowed(detail);
            default -> {
                final var resolved = Status.fromStatusCode(status);
                final var effective = resolved != null ? resolved : Status.INTERNAL_SERVER_ERROR;
                yield HttpProblem.builder()
                        .withTitle(effective.getReasonPhrase())
                        .withStatus(effective)
                        .withDetail(detail)
                        .build();
            }
        };
    }
}
