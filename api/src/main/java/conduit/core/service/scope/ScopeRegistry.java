package conduit.core.service.scope;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import conduit.core.config.OAuthConfig;
import conduit.core.model.auth.OperationScopes;

/**
 * Maps protocol operations (tool names) to the scopes they require.
 *
 * <p>Each operation needs a gateway scope, checked by this server, and the upstream platform
 * scopes its API calls use. Operations not listed here require no scopes.
 */
@ApplicationScoped
public class ScopeRegistry {

    public static final String CONTENT_READ = "conduit:mcp:content:read";
    public static final String DATASOURCE_READ = "conduit:mcp:datasource:read";
    public static final String WORKBOOK_READ = "conduit:mcp:workbook:read";
    public static final String VIEW_READ = "conduit:mcp:view:read";
    public static final String VIEW_DOWNLOAD = "conduit:mcp:view:download";
    public static final String PULSE_READ = "conduit:mcp:pulse:read";
    public static final String INSIGHT_CREATE = "conduit:mcp:insight:create";

    static final String API_CONTENT_READ = "tableau:content:read";
    static final String API_VIZ_DATA_READ = "tableau:viz_data_service:read";
    static final String API_VIEWS_DOWNLOAD = "tableau:views:download";
    static final String API_METRIC_DEFINITIONS_READ = "tableau:insight_definitions_metrics:read";
    static final String API_METRICS_READ = "tableau:insight_metrics:read";
    static final String API_SUBSCRIPTIONS_READ = "tableau:metric_subscriptions:read";
    static final String API_INSIGHTS_READ = "tableau:insights:read";
    static final String API_INSIGHT_BRIEF_CREATE = "tableau:insight_brief:create";

    private static final Map<String, OperationScopes> OPERATIONS = buildOperations();

    private final boolean enforce;
    private final boolean advertiseUpstreamScopes;

    @Inject
    public ScopeRegistry(OAuthConfig config) {
        this(config.enforceScopes(), config.advertiseUpstreamScopes());
    }

    public ScopeRegistry(boolean enforce, boolean advertiseUpstreamScopes) {
        this.enforce = enforce;
        this.advertiseUpstreamScopes = advertiseUpstreamScopes;
    }

    private static Map<String, OperationScopes> buildOperations() {
        final Map<String, OperationScopes> map = new LinkedHashMap<>();
        map.put("list-datasources", scopes(DATASOURCE_READ, API_CONTENT_READ));
        map.put("list-workbooks", scopes(WORKBOOK_READ, API_CONTENT_READ));
        map.put("list-views", scopes(VIEW_READ, API_CONTENT_READ));
        map.put("query-datasource", scopes(DATASOURCE_READ, API_VIZ_DATA_READ));
        map.put("get-datasource-metadata", scopes(DATASOURCE_READ, API_CONTENT_READ, API_VIZ_DATA_READ));
        map.put("get-workbook", scopes(WORKBOOK_READ, API_CONTENT_READ));
        map.put("get-view-data", scopes(VIEW_DOWNLOAD, API_VIEWS_DOWNLOAD));
        map.put("get-view-image", scopes(VIEW_DOWNLOAD, API_VIEWS_DOWNLOAD));
        map.put("list-all-pulse-metric-definitions", scopes(PULSE_READ, API_METRIC_DEFINITIONS_READ));
        map.put("list-pulse-metric-definitions-from-definition-ids", scopes(PULSE_READ, API_METRIC_DEFINITIONS_READ));
        map.put("list-pulse-metrics-from-metric-definition-id", scopes(PULSE_READ, API_METRIC_DEFINITIONS_READ));
        map.put("list-pulse-metrics-from-metric-ids", scopes(PULSE_READ, API_METRICS_READ));
        map.put("list-pulse-metric-subscriptions", scopes(PULSE_READ, API_SUBSCRIPTIONS_READ));
        map.put("generate-pulse-metric-value-insight-bundle", scopes(INSIGHT_CREATE, API_INSIGHTS_READ));
        map.put("generate-pulse-insight-brief", scopes(INSIGHT_CREATE, API_INSIGHT_BRIEF_CREATE));
        map.put("search-content", scopes(CONTENT_READ, API_CONTENT_READ));
        return Collections.unmodifiableMap(map);
    }

    private static OperationScopes scopes(String gateway, String... upstream) {
        return new OperationScopes(Set.of(gateway), Set.of(upstream));
    }

    /**
     * Whether per-operation scopes are enforced.
     */
    public boolean isEnforced() {
        return enforce;
    }

    /**
     * Names of every registered operation, in registration order.
     */
    public Set<String> operations() {
        return OPERATIONS.keySet();
    }

    /**
     * Scopes declared for an operation, regardless of enforcement.
     *
     * @param operation the operation name
     * @return declared scopes, or empty for unknown operations
     */
    public Optional<OperationScopes> declared(String operation) {
        return Optional.ofNullable(OPERATIONS.get(operation));
    }

    /**
     * Scopes required to invoke an operation. Empty when enforcement is off or the operation
     * is unknown.
     *
     * @param operation the operation name
     * @return required scopes
     */
    public OperationScopes requiredFor(String operation) {
        if (!enforce) {
            return OperationScopes.none();
        }
        return declared(operation).orElse(OperationScopes.none());
    }

    /**
     * Union of the gateway and upstream scopes required by several operations.
     *
     * @param operations operation names
     * @return required scopes, gateway scopes first
     */
    public Set<String> requiredFor(Collection<String> operations) {
        final var gateway = new LinkedHashSet<String>();
        final var upstream = new LinkedHashSet<String>();
        for (String operation : operations) {
            final var required = requiredFor(operation);
            gateway.addAll(required.gateway());
            upstream.addAll(required.upstream());
        }
        gateway.addAll(upstream);
        return gateway;
    }

    /**
     * Every gateway scope any operation declares.
     */
    public Set<String> gatewayScopes() {
        final var scopes = new LinkedHashSet<String>();
        OPERATIONS.values().forEach(op -> scopes.addAll(op.gateway()));
        return scopes;
    }

    /**
     * Every upstream scope any operation declares.
     */
    public Set<String> upstreamScopes() {
        final var scopes = new LinkedHashSet<String>();
        OPERATIONS.values().forEach(op -> scopes.addAll(op.upstream()));
        return scopes;
    }

    /**
     * Scopes a client may be granted: gateway scopes followed by upstream scopes.
     */
    public Set<String> supportedScopes() {
        final var scopes = new LinkedHashSet<>(gatewayScopes());
        scopes.addAll(upstreamScopes());
        return scopes;
    }

    /**
     * Scopes listed in discovery metadata.
     *
     * @param includeUpstream whether upstream scopes are listed
     */
    public Set<String> advertisedScopes(boolean includeUpstream) {
        return includeUpstream ? supportedScopes() : gatewayScopes();
    }

    /**
     * Scopes listed in the protected-resource metadata, per configuration.
     */
    public Set<String> advertisedResourceScopes() {
        return advertisedScopes(advertiseUpstreamScopes);
    }

    /**
     * Scopes to grant for a requested scope string: the supported subset, or every supported
     * scope when none of the requested ones is supported.
     *
     * @param requested the {@code scope} request parameter, may be null
     * @return granted scopes
     */
    public Set<String> grant(String requested) {
        final var supported = supportedScopes();
        final var granted = Scopes.supportedSubset(Scopes.parse(requested), supported);
        return granted.isEmpty() ? supported : granted;
    }
}
