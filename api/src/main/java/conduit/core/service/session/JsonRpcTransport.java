package conduit.core.service.session;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import conduit.core.model.auth.AuthContext;
import conduit.core.model.session.ProtocolTransport;
import conduit.core.service.scope.ScopeRegistry;
import conduit.spi.OperationHandler;

/**
 * JSON-RPC 2.0 transport bound to one session.
 *
 * <p>Answers {@code initialize}, {@code ping} and {@code tools/list} itself and dispatches
 * {@code tools/call} to the {@link OperationHandler} registered under {@code params.name}.
 * Notifications (messages without an id) produce no response.
 */
public class JsonRpcTransport implements ProtocolTransport {

    private static final Logger LOG = Logger.getLogger(JsonRpcTransport.class);

    static final int PARSE_ERROR = -32700;
    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int INTERNAL_ERROR = -32603;

    static final String SERVER_NAME = "conduit";

    private final String sessionId;
    private final Map<String, OperationHandler> handlers;
    private final ScopeRegistry scopes;
    private final ObjectMapper objectMapper;
    private final String serverVersion;
    private final List<Runnable> closeHooks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean open = new AtomicBoolean(true);

    public JsonRpcTransport(
            String sessionId,
            Map<String, OperationHandler> handlers,
            ScopeRegistry scopes,
            ObjectMapper objectMapper,
            String serverVersion) {
        this.sessionId = sessionId;
        this.handlers = handlers;
        this.scopes = scopes;
        this.objectMapper = objectMapper;
        this.serverVersion = serverVersion;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public Uni<String> handle(String body, AuthContext auth) {
        if (!open.get()) {
            return Uni.createFrom().failure(new IllegalStateException("Transport is closed"));
        }
        final JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            return Uni.createFrom().item(write(error(NullNode.getInstance(), PARSE_ERROR, "Parse error")));
        }
        if (root == null || root.isMissingNode()) {
            return Uni.createFrom().item(write(error(NullNode.getInstance(), PARSE_ERROR, "Parse error")));
        }

        if (!root.isArray()) {
            return dispatch(root, auth).map(response -> response.map(this::write).orElse(""));
        }
        if (root.isEmpty()) {
            return Uni.createFrom().item(write(error(NullNode.getInstance(), INVALID_REQUEST, "Invalid Request")));
        }

        final List<Uni<Optional<JsonNode>>> calls = new ArrayList<>();
        root.forEach(message -> calls.add(dispatch(message, auth)));
        return Uni.join().all(calls).andFailFast().map(responses -> {
            final ArrayNode batch = objectMapper.createArrayNode();
            responses.forEach(response -> response.ifPresent(batch::add));
            return batch.isEmpty() ? "" : write(batch);
        });
    }

    /**
     * Handle one message. Notifications yield no response.
     */
    private Uni<Optional<JsonNode>> dispatch(JsonNode message, AuthContext auth) {
        final var id = message.get("id");
        final var method = message.path("method");
        if (!message.isObject() || !method.isTextual()) {
            return Uni.createFrom().item(Optional.of(
                    error(id == null ? NullNode.getInstance() : id, INVALID_REQUEST, "Invalid Request")));
        }
        final var params = message.path("params");

        final Uni<JsonNode> result = switch (method.asText()) {
            case "initialize" -> Uni.createFrom().item(initialize(params));
            case "ping" -> Uni.createFrom().item(objectMapper.createObjectNode());
            case "tools/list" -> Uni.createFrom().item(listTools());
            case "tools/call" -> callTool(params, auth);
            default -> {
                if (method.asText().startsWith("notifications/")) {
                    yield Uni.createFrom().<JsonNode>nullItem();
                }
                yield Uni.createFrom().<JsonNode>failure(
                        new RpcError(METHOD_NOT_FOUND, "Method not found: " + method.asText()));
            }
        };

        if (id == null) {
            return result.map(ignored -> Optional.<JsonNode>empty())
                    .onFailure()
                    .recoverWithItem(failure -> {
                        LOG.debugf("Notification %s failed: %s", method.asText(), failure.getMessage());
                        return Optional.empty();
                    });
        }
        return result.map(value -> Optional.<JsonNode>of(success(id, value)))
                .onFailure(RpcError.class)
                .recoverWithItem(failure -> {
                    final var rpcError = (RpcError) failure;
                    return Optional.of(error(id, rpcError.code(), rpcError.getMessage()));
                })
                .onFailure()
                .recoverWithItem(failure -> {
                    LOG.errorf(failure, "Unhandled error in session %s", sessionId);
                    return Optional.of(error(id, INTERNAL_ERROR, "Internal error"));
                });
    }

    private JsonNode initialize(JsonNode params) {
        final ObjectNode result = objectMapper.createObjectNode();
        result.put("protocolVersion", ProtocolVersions.negotiate(params.path("protocolVersion").asText(null)));
        result.putObject("capabilities").putObject("tools");
        result.putObject("serverInfo").put("name", SERVER_NAME).put("version", serverVersion);
        return result;
    }

    private JsonNode listTools() {
        final ObjectNode result = objectMapper.createObjectNode();
        final ArrayNode tools = result.putArray("tools");
        for (final var name : scopes.operations()) {
            final var handler = handlers.get(name);
            final ObjectNode tool = tools.addObject().put("name", name);
            if (handler != null) {
                tool.put("description", handler.description());
                tool.set("inputSchema", handler.inputSchema());
            } else {
                tool.putObject("inputSchema").put("type", "object");
            }
        }
        handlers.values().stream()
                .filter(handler -> !scopes.operations().contains(handler.name()))
                .forEach(handler -> tools.addObject()
                        .put("name", handler.name())
                        .put("description", handler.description())
                        .set("inputSchema", handler.inputSchema()));
        return result;
    }

    private Uni<JsonNode> callTool(JsonNode params, AuthContext auth) {
        final var name = params.path("name");
        if (!name.isTextual()) {
            return Uni.createFrom().failure(new RpcError(INVALID_PARAMS, "Missing tool name"));
        }
        final var handler = handlers.get(name.asText());
        if (handler == null) {
            return Uni.createFrom().failure(new RpcError(METHOD_NOT_FOUND, "Unknown tool: " + name.asText()));
        }
        final var arguments = params.path("arguments").isObject()
                ? params.get("arguments")
                : objectMapper.createObjectNode();
        return handler.invoke(arguments, auth)
                .onFailure(failure -> !(failure instanceof RpcError))
                .recoverWithItem(failure -> {
                    LOG.warnf("Tool %s failed: %s", name.asText(), failure.getMessage());
                    final ObjectNode result = objectMapper.createObjectNode();
                    result.putArray("content").addObject()
                            .put("type", "text")
                            .put("text", String.valueOf(failure.getMessage()));
                    result.put("isError", true);
                    return result;
                });
    }

    private ObjectNode success(JsonNode id, JsonNode result) {
        final ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.set("result", result == null ? objectMapper.createObjectNode() : result);
        return response;
    }

    private ObjectNode error(JsonNode id, int code, String message) {
        final ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.putObject("error").put("code", code).put("message", message);
        return response;
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON-RPC response", e);
        }
    }

    @Override
    public void onClose(Runnable hook) {
        closeHooks.add(hook);
    }

    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        for (final var hook : closeHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Close hook failed for session %s", sessionId);
            }
        }
        closeHooks.clear();
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    /**
     * A JSON-RPC error to report to the caller.
     */
    static final class RpcError extends RuntimeException {

        private final int code;

        RpcError(int code, String message) {
            super(message, null, false, false);
            this.code = code;
        }

        int code() {
            return code;
        }
    }
}
