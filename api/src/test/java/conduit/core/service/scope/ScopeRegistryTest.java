package conduit.core.service.scope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ScopeRegistry")
class ScopeRegistryTest {

    private final ScopeRegistry enforced = new ScopeRegistry(true, false);

    @Nested
    @DisplayName("requiredFor()")
    class RequiredForTests {

        @Test
        @DisplayName("should require gateway and upstream scopes for a known operation")
        void shouldRequireBothScopes() {
            final var required = enforced.requiredFor("get-datasource-metadata");

            assertEquals(Set.of(ScopeRegistry.DATASOURCE_READ), required.gateway());
            assertEquals(
                    Set.of(ScopeRegistry.API_CONTENT_READ, ScopeRegistry.API_VIZ_DATA_READ), required.upstream());
        }

        @Test
        @DisplayName("should require nothing for an unknown operation")
        void shouldRequireNothingForUnknown() {
            assertTrue(enforced.requiredFor("initialize").gateway().isEmpty());
            assertTrue(enforced.requiredFor("initialize").upstream().isEmpty());
        }

        @Test
        @DisplayName("should require nothing when enforcement is off")
        void shouldRequireNothingWhenNotEnforced() {
            final var relaxed = new ScopeRegistry(false, false);

            assertTrue(relaxed.requiredFor(List.of("query-datasource", "get-view-image")).isEmpty());
            assertTrue(relaxed.declared("query-datasource").isPresent());
        }

        @Test
        @DisplayName("should union scopes across operations without duplicates")
        void shouldUnionScopes() {
            final var required = enforced.requiredFor(List.of("list-workbooks", "get-workbook", "query-datasource"));

            assertEquals(
                    Set.of(
                            ScopeRegistry.WORKBOOK_READ,
                            ScopeRegistry.DATASOURCE_READ,
                            ScopeRegistry.API_CONTENT_READ,
                            ScopeRegistry.API_VIZ_DATA_READ),
                    required);
        }

        @Test
        @DisplayName("should list gateway scopes before upstream scopes")
        void shouldListGatewayScopesFirst() {
            final var required = List.copyOf(enforced.requiredFor(List.of("get-view-image")));

            assertEquals(List.of(ScopeRegistry.VIEW_DOWNLOAD, ScopeRegistry.API_VIEWS_DOWNLOAD), required);
        }
    }

    @Nested
    @DisplayName("catalogue")
    class CatalogueTests {

        @Test
        @DisplayName("should register every operation")
        void shouldRegisterEveryOperation() {
            assertEquals(16, enforced.operations().size());
            assertTrue(enforced.operations().contains("search-content"));
        }

        @Test
        @DisplayName("should support gateway and upstream scopes")
        void shouldSupportAllScopes() {
            final var supported = enforced.supportedScopes();

            assertTrue(supported.containsAll(enforced.gatewayScopes()));
            assertTrue(supported.containsAll(enforced.upstreamScopes()));
            assertEquals(enforced.gatewayScopes().size() + enforced.upstreamScopes().size(), supported.size());
        }

        @Test
        @DisplayName("should advertise upstream scopes only when configured")
        void shouldAdvertiseUpstreamScopesWhenConfigured() {
            assertEquals(enforced.gatewayScopes(), enforced.advertisedResourceScopes());
            assertEquals(enforced.supportedScopes(), new ScopeRegistry(true, true).advertisedResourceScopes());
        }

        @Test
        @DisplayName("should keep gateway scopes in the gateway namespace")
        void shouldNamespaceGatewayScopes() {
            enforced.gatewayScopes().forEach(scope -> assertTrue(scope.startsWith("conduit:mcp:")));
            enforced.upstreamScopes().forEach(scope -> assertFalse(scope.startsWith("conduit:")));
        }
    }

    @Nested
    @DisplayName("grant()")
    class GrantTests {

        @Test
        @DisplayName("should grant the supported subset of requested scopes")
        void shouldGrantSupportedSubset() {
            final var granted = enforced.grant(ScopeRegistry.PULSE_READ + " unknown:scope " + ScopeRegistry.VIEW_READ);

            assertEquals(Set.of(ScopeRegistry.PULSE_READ, ScopeRegistry.VIEW_READ), granted);
        }

        @Test
        @DisplayName("should grant every supported scope when none is requested")
        void shouldGrantAllWhenNoneRequested() {
            assertEquals(enforced.supportedScopes(), enforced.grant(null));
            assertEquals(enforced.supportedScopes(), enforced.grant(""));
        }

        @Test
        @DisplayName("should grant every supported scope when nothing requested is supported")
        void shouldGrantAllWhenNothingSupported() {
            assertEquals(enforced.supportedScopes(), enforced.grant("openid profile"));
        }
    }
}
