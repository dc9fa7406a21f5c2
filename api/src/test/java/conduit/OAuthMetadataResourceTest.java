package conduit;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@QuarkusTest
@DisplayName("OAuth discovery endpoints")
class OAuthMetadataResourceTest {

    @Test
    @DisplayName("should publish authorization server metadata for the issuer")
    void shouldPublishAuthorizationServerMetadata() {
        given().when()
                .get("/.well-known/oauth-authorization-server")
                .then()
                .statusCode(200)
                .body("issuer", is("http://localhost:8081"))
                .body("authorization_endpoint", is("http://localhost:8081/oauth/authorize"))
                .body("token_endpoint", is("http://localhost:8081/oauth/token"))
                .body("registration_endpoint", is("http://localhost:8081/oauth/register"))
                .body("code_challenge_methods_supported", contains("S256"))
                .body("grant_types_supported", contains("authorization_code", "refresh_token"))
                .body("scopes_supported", hasItem("conduit:mcp:datasource:read"))
                .body("scopes_supported", hasItem("tableau:viz_data_service:read"));
    }

    @Test
    @DisplayName("should publish protected resource metadata with gateway scopes only")
    void shouldPublishProtectedResourceMetadata() {
        given().when()
                .get("/.well-known/oauth-protected-resource")
                .then()
                .statusCode(200)
                .body("resource", is("http://localhost:8081/mcp"))
                .body("authorization_servers", contains("http://localhost:8081"))
                .body("bearer_methods_supported", contains("header"))
                .body("scopes_supported", hasSize(7))
                .body("scopes_supported", not(hasItem("tableau:content:read")));
    }
}
