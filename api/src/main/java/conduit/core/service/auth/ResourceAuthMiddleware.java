package conduit.core.service.auth;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import conduit.core.model.auth.AuthContext;
import conduit.core.model.auth.AuthDecision;
import conduit.core.model.auth.ResourceRequest;
import conduit.core.model.oauth.OAuthError;
import conduit.core.port.in.ResourceAuthorization;
import conduit.core.port.out.Metrics;
import conduit.core.service.oauth.AccessTokenService;
import conduit.core.service.scope.ScopeRegistry;
import conduit.core.service.scope.Scopes;

/**
 * Bearer token authentication and scope enforcement for the protocol endpoint.
 *
 * <p>Operations are read from the JSON-RPC body: the method name, or {@code params.name} for
 * {@code tools/call}. A body that is not valid JSON names no operations.
 */
@ApplicationScoped
public class ResourceAuthMiddleware implements ResourceAuthorization {

    private static final Logger LOG = Logger.getLogger(ResourceAuthMiddleware.class);

    static final String REALM = "conduit";
    static final String RESOURCE_METADATA_PATH = "/.well-known/oauth-protected-resource";
    static final String BEARER_PREFIX = "Bearer ";
    static final String EVENT_STREAM = "text/event-stream";
    static final String INITIALIZE = "initialize";
    static final String TOOLS_CALL = "tools/call";

    private final AccessTokenService accessTokens;
    private final ScopeRegistry scopes;
    private final ObjectMapper objectMapper;
    private final Metrics metrics;

    @Inject
    public ResourceAuthMiddleware(
            AccessTokenService accessTokens, ScopeRegistry scopes, ObjectMapper objectMapper, Metrics metrics) {
        this.accessTokens = accessTokens;
        this.scopes = scopes;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public AuthDecision authorize(ResourceRequest request) {
        final var eventStream = negotiatesEventStream(request.method(), request.accept());
        final var operations = operations(request.body());
        final var resourceMetadata = request.baseUrl() + RESOURCE_METADATA_PATH;

        final var token = bearerToken(request.authorization());
        if (token == null) {
            var challenge = "Bearer realm=\"" + REALM + "\", resource_metadata=\"" + resourceMetadata + "\"";
            final var hint = scopeHint(operations);
            if (!hint.isEmpty()) {
                challenge += ", scope=\"" + Scopes.format(hint) + "\"";
            }
            return deny(
                    OAuthError.UNAUTHORIZED, "Authorization required. Use OAuth 2.1 flow.", challenge, eventStream);
        }

        final var claims = accessTokens.verify(token);
        if (claims.isEmpty()) {
            final var challenge = "Bearer realm=\"" + REALM + "\", error=\"invalid_token\", error_description=\""
                    + AccessTokenService.INVALID_TOKEN_DESCRIPTION + "\", resource_metadata=\""
                    + resourceMetadata + "\"";
            return deny(
                    OAuthError.INVALID_TOKEN, AccessTokenService.INVALID_TOKEN_DESCRIPTION, challenge, eventStream);
        }

        final var granted = claims.get().scopes();
        final var missing = new LinkedHashSet<String>();
        for (final var scope : scopes.requiredFor(operations)) {
            if (!granted.contains(scope)) {
                missing.add(scope);
            }
        }
        if (!missing.isEmpty()) {
            final var formatted = Scopes.format(missing);
            LOG.debugf("Client %s lacks scopes %s for %s", claims.get().clientId(), formatted, operations);
            return deny(
                    OAuthError.INSUFFICIENT_SCOPE,
                    "Missing required scopes: " + formatted,
                    "Bearer error=\"insufficient_scope\", scope=\"" + formatted + "\"",
                    eventStream);
        }

        return new AuthDecision.Allowed(new AuthContext(claims.get()));
    }

    private AuthDecision deny(OAuthError error, String description, String challenge, boolean eventStream) {
        metrics.recordAuthDenied(error.code());
        return new AuthDecision.Denied(error, description, challenge, eventStream);
    }

    /**
     * Scopes to advertise on a 401: everything supported for {@code initialize}, otherwise the
     * union required by the requested operations. Empty when enforcement is off.
     */
    private Set<String> scopeHint(List<String> operations) {
        if (!scopes.isEnforced()) {
            return Set.of();
        }
        if (operations.contains(INITIALIZE)) {
            return scopes.supportedScopes();
        }
        return scopes.requiredFor(operations);
    }

    static String bearerToken(String authorization) {
        if (authorization == null || authorization.length() <= BEARER_PREFIX.length()) {
            return null;
        }
        if (!authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        final var token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    /**
     * Whether the response should be a server-sent event stream: the client accepts
     * {@code text/event-stream} and either opened a stream (GET) or does not also accept JSON.
     */
    static boolean negotiatesEventStream(String method, String accept) {
        if (accept == null) {
            return false;
        }
        final var normalized = accept.toLowerCase(Locale.ROOT);
        if (!normalized.contains(EVENT_STREAM)) {
            return false;
        }
        return "GET".equalsIgnoreCase(method) || !normalized.contains("application/json");
    }

    /**
     * Operation names requested by a JSON-RPC message or batch.
     */
    List<String> operations(String body) {
        final List<String> operations = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return operations;
        }
        final JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return operations;
        }
        if (root == null) {
            return operations;
        }
        if (root.isArray()) {
            root.forEach(message -> addOperation(message, operations));
        } else {
            addOperation(root, operations);
        }
        return operations;
    }

    private static void addOperation(JsonNode message, List<String> operations) {
        final var method = message.path("method");
        if (!method.isTextual()) {
            return;
        }
        if (TOOLS_CALL.equals(method.asText())) {
            final var name = message.path("params").path("name");
            if (name.isTextual()) {
                operations.add(name.asText());
            }
            return;
        }
        operations.add(method.asText());
    }
}
