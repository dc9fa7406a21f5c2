package conduit.core.service.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import conduit.core.model.session.ProtocolTransport;
import conduit.core.service.scope.ScopeRegistry;
import conduit.spi.OperationHandler;

/**
 * Creates session transports wired to every discovered {@link OperationHandler}.
 */
@ApplicationScoped
public class JsonRpcTransportFactory {

    private static final Logger LOG = Logger.getLogger(JsonRpcTransportFactory.class);

    private final Map<String, OperationHandler> handlers;
    private final ScopeRegistry scopes;
    private final ObjectMapper objectMapper;
    private final String serverVersion;

    @Inject
    public JsonRpcTransportFactory(
            Instance<OperationHandler> handlers,
            ScopeRegistry scopes,
            ObjectMapper objectMapper,
            @ConfigProperty(name = "quarkus.application.version", defaultValue = "dev") String serverVersion) {
        this(index(handlers), scopes, objectMapper, serverVersion);
    }

    public JsonRpcTransportFactory(
            Map<String, OperationHandler> handlers,
            ScopeRegistry scopes,
            ObjectMapper objectMapper,
            String serverVersion) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
        this.scopes = scopes;
        this.objectMapper = objectMapper;
        this.serverVersion = serverVersion;
    }

    private static Map<String, OperationHandler> index(Iterable<OperationHandler> handlers) {
        final Map<String, OperationHandler> byName = new LinkedHashMap<>();
        for (final var handler : handlers) {
            final var previous = byName.putIfAbsent(handler.name(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate operation handler: " + handler.name());
            }
            LOG.debugf("Registered operation handler %s", handler.name());
        }
        return byName;
    }

    public ProtocolTransport create(String sessionId) {
        return new JsonRpcTransport(sessionId, handlers, scopes, objectMapper, serverVersion);
    }
}
