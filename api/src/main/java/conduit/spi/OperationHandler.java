package conduit.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.smallrye.mutiny.Uni;

import conduit.core.model.auth.AuthContext;

/**
 * A protocol operation (tool) invoked through {@code tools/call}.
 *
 * <p>Handlers are discovered as CDI beans and dispatched by {@link #name()}. The scopes an
 * operation needs are declared in {@link conduit.core.service.scope.ScopeRegistry} and checked
 * before the handler runs.
 */
public interface OperationHandler {

    /**
     * Operation name, unique across handlers.
     */
    String name();

    /**
     * Human readable description listed by {@code tools/list}.
     */
    default String description() {
        return "";
    }

    /**
     * JSON schema of the call arguments.
     */
    default JsonNode inputSchema() {
        return JsonNodeFactory.instance.objectNode().put("type", "object");
    }

    /**
     * Run the operation.
     *
     * @param arguments the {@code params.arguments} object, never null
     * @param auth the caller, carrying the upstream credential to call the platform with
     * @return the {@code tools/call} result
     */
    Uni<JsonNode> invoke(JsonNode arguments, AuthContext auth);
}
