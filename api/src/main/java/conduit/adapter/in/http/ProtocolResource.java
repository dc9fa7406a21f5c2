package conduit.adapter.in.http;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import conduit.adapter.in.dto.OAuthErrorResponse;
import conduit.adapter.in.problem.ProtocolProblem;
import conduit.core.config.OAuthConfig;
import conduit.core.model.auth.AuthContext;
import conduit.core.model.auth.AuthDecision;
import conduit.core.model.auth.ResourceRequest;
import conduit.core.port.in.ResourceAuthorization;
import conduit.core.port.in.SessionManagement;
import conduit.core.service.session.ProtocolVersions;

/**
 * The protected protocol endpoint (streamable HTTP transport).
 *
 * <p>Every request is authenticated first. {@code POST} carries JSON-RPC messages,
 * {@code DELETE} ends a session. This server offers no standalone event stream, so
 * {@code GET} is answered with 405 once the session is validated.
 */
@Path("/mcp")
public class ProtocolResource {

    private static final Logger LOG = Logger.getLogger(ProtocolResource.class);

    static final String SESSION_HEADER = "mcp-session-id";
    static final String PROTOCOL_VERSION_HEADER = "mcp-protocol-version";
    static final String EVENT_STREAM = "text/event-stream";

    private final ResourceAuthorization authorization;
    private final SessionManagement sessions;
    private final OAuthConfig config;
    private final ObjectMapper objectMapper;

    @Inject
    public ProtocolResource(
            ResourceAuthorization authorization,
            SessionManagement sessions,
            OAuthConfig config,
            ObjectMapper objectMapper) {
        this.authorization = authorization;
        this.sessions = sessions;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @POST
    @Consumes(MediaType.WILDCARD)
    public Uni<Response> post(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @HeaderParam(HttpHeaders.ACCEPT) String accept,
            @HeaderParam(SESSION_HEADER) String sessionId,
            @HeaderParam(PROTOCOL_VERSION_HEADER) String protocolVersion,
            String body) {
        final var decision = authorization.authorize(
                new ResourceRequest("POST", authorizationHeader, accept, config.issuer(), body));
        if (decision instanceof AuthDecision.Denied denied) {
            return Uni.createFrom().item(denial(denied));
        }
        final var unsupported = checkProtocolVersion(protocolVersion);
        if (unsupported != null) {
            return Uni.createFrom().item(unsupported);
        }

        final AuthContext auth = ((AuthDecision.Allowed) decision).context();
        return sessions.handle(sessionId, body, auth).map(response -> {
            final var builder = response.hasBody()
                    ? Response.ok(response.body(), MediaType.APPLICATION_JSON_TYPE)
                    : Response.accepted();
            return builder.header(SESSION_HEADER, response.sessionId()).build();
        });
    }

    @GET
    public Uni<Response> get(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @HeaderParam(HttpHeaders.ACCEPT) String accept,
            @HeaderParam(SESSION_HEADER) String sessionId,
            @HeaderParam(PROTOCOL_VERSION_HEADER) String protocolVersion) {
        final var decision = authorization.authorize(
                new ResourceRequest("GET", authorizationHeader, accept, config.issuer(), null));
        if (decision instanceof AuthDecision.Denied denied) {
            return Uni.createFrom().item(denial(denied));
        }
        final var unsupported = checkProtocolVersion(protocolVersion);
        if (unsupported != null) {
            return Uni.createFrom().item(unsupported);
        }
        if (sessionId == null) {
            throw ProtocolProblem.badRequest("Bad Request: No valid session ID provided");
        }
        final AuthContext auth = ((AuthDecision.Allowed) decision).context();
        return sessions.require(sessionId, auth).map(ignored -> Response.status(Response.Status.METHOD_NOT_ALLOWED)
                .header(HttpHeaders.ALLOW, "POST, DELETE")
                .type("application/problem+json")
                .entity(ProtocolProblem.methodNotAllowed("This server does not offer a standalone event stream"))
                .build());
    }

    @DELETE
    public Uni<Response> delete(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @HeaderParam(HttpHeaders.ACCEPT) String accept,
            @HeaderParam(SESSION_HEADER) String sessionId,
            @HeaderParam(PROTOCOL_VERSION_HEADER) String protocolVersion) {
        final var decision = authorization.authorize(
                new ResourceRequest("DELETE", authorizationHeader, accept, config.issuer(), null));
        if (decision instanceof AuthDecision.Denied denied) {
            return Uni.createFrom().item(denial(denied));
        }
        final var unsupported = checkProtocolVersion(protocolVersion);
        if (unsupported != null) {
            return Uni.createFrom().item(unsupported);
        }
        if (sessionId == null) {
            throw ProtocolProblem.badRequest("Bad Request: No valid session ID provided");
        }
        final AuthContext auth = ((AuthDecision.Allowed) decision).context();
        return sessions.terminate(sessionId, auth).map(ignored -> Response.ok().build());
    }

    private Response denial(AuthDecision.Denied denied) {
        final var body = new OAuthErrorResponse(denied.error().code(), denied.description());
        final var builder = Response.status(denied.status()).header(HttpHeaders.WWW_AUTHENTICATE, denied.challenge());
        if (denied.eventStream()) {
            return builder.type(EVENT_STREAM)
                    .header("Cache-Control", "no-cache")
                    .entity("event: error\ndata: " + write(body) + "\n\n")
                    .build();
        }
        return builder.type(MediaType.APPLICATION_JSON_TYPE).entity(body).build();
    }

    /**
     * 400 with a JSON-RPC error when the client asks for a protocol revision this server
     * does not speak; null when the header is absent or supported.
     */
    private Response checkProtocolVersion(String protocolVersion) {
        if (protocolVersion == null || ProtocolVersions.isSupported(protocolVersion)) {
            return null;
        }
        LOG.debugf("Rejecting unsupported protocol version %s", protocolVersion);
        final ObjectNode error = objectMapper.createObjectNode();
        error.put("jsonrpc", "2.0");
        error.putNull("id");
        error.putObject("error")
                .put("code", -32600)
                .put("message", "Bad Request: Unsupported protocol version (supported versions: "
                        + String.join(", ", ProtocolVersions.SUPPORTED) + ")");
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(write(error))
                .build();
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }
}
