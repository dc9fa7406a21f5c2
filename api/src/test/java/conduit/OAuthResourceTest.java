package conduit;

import static conduit.OAuthTestClient.CLIENT_ID;
import static conduit.OAuthTestClient.CLIENT_STATE;
import static conduit.OAuthTestClient.REDIRECT_URI;
import static conduit.OAuthTestClient.VERIFIER;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import conduit.core.model.oauth.UpstreamException;
import conduit.mock.MockUpstreamIdentityProvider;

@QuarkusTest
@DisplayName("OAuth endpoints")
class OAuthResourceTest {

    @Inject
    MockUpstreamIdentityProvider upstream;

    @BeforeEach
    void setUp() {
        upstream.reset();
    }

    @Nested
    @DisplayName("GET /oauth/authorize")
    class AuthorizeTests {

        @Test
        @DisplayName("should redirect to the upstream login with the gateway callback")
        void shouldRedirectToUpstream() {
            final var login = OAuthTestClient.authorize(null);
            final var params = OAuthTestClient.query(login);

            assertTrue(login.toString().startsWith(MockUpstreamIdentityProvider.SERVER_URL + "/oauth2/v1/auth?"));
            assertEquals("http://localhost:8081/oauth/callback", params.get("redirect_uri"));
            assertEquals("S256", params.get("code_challenge_method"));
            assertEquals("code", params.get("response_type"));
            assertNotNull(params.get("device_id"));
            assertTrue(params.get("state").contains(":"));
        }

        @Test
        @DisplayName("should reject a missing client id")
        void shouldRejectMissingClientId() {
            given().redirects()
                    .follow(false)
                    .queryParam("redirect_uri", REDIRECT_URI)
                    .queryParam("response_type", "code")
                    .queryParam("code_challenge", OAuthTestClient.CHALLENGE)
                    .queryParam("code_challenge_method", "S256")
                    .when()
                    .get("/oauth/authorize")
                    .then()
                    .statusCode(400)
                    .body("error", is("invalid_request"))
                    .body("error_description", containsString("client_id"));
        }

        @Test
        @DisplayName("should reject the plain challenge method")
        void shouldRejectPlainMethod() {
            given().redirects()
                    .follow(false)
                    .queryParam("client_id", CLIENT_ID)
                    .queryParam("redirect_uri", REDIRECT_URI)
                    .queryParam("response_type", "code")
                    .queryParam("code_challenge", OAuthTestClient.CHALLENGE)
                    .queryParam("code_challenge_method", "plain")
                    .when()
                    .get("/oauth/authorize")
                    .then()
                    .statusCode(400)
                    .body("error", is("invalid_request"));
        }
    }

    @Nested
    @DisplayName("GET /oauth/callback")
    class CallbackTests {

        @Test
        @DisplayName("should redirect back to the client with a code and its state")
        void shouldRedirectToClient() {
            final var redirect = OAuthTestClient.callback(OAuthTestClient.authorize(null));
            final var params = OAuthTestClient.query(redirect);

            assertTrue(redirect.toString().startsWith(REDIRECT_URI + "?"));
            assertNotNull(params.get("code"));
            assertEquals(CLIENT_STATE, params.get("state"));
        }

        @Test
        @DisplayName("should reject an unknown state")
        void shouldRejectUnknownState() {
            given().redirects()
                    .follow(false)
                    .queryParam("code", "upstream-code")
                    .queryParam("state", "unknown:state")
                    .when()
                    .get("/oauth/callback")
                    .then()
                    .statusCode(400)
                    .body("error", is("invalid_request"));
        }

        @Test
        @DisplayName("should report an upstream outage as a server error")
        void shouldReportUpstreamOutage() {
            final var login = OAuthTestClient.authorize(null);
            upstream.failExchangeWith(new UpstreamException("unavailable", 503));

            given().redirects()
                    .follow(false)
                    .queryParam("code", "upstream-code")
                    .queryParam("state", OAuthTestClient.query(login).get("state"))
                    .when()
                    .get("/oauth/callback")
                    .then()
                    .statusCode(500)
                    .body("error", is("server_error"));
        }
    }

    @Nested
    @DisplayName("POST /oauth/token")
    class TokenTests {

        @Test
        @DisplayName("should issue tokens for a valid code and verifier")
        void shouldIssueTokens() {
            given().contentType(ContentType.URLENC)
                    .formParam("grant_type", "authorization_code")
                    .formParam("code", OAuthTestClient.authorizationCode(null))
                    .formParam("code_verifier", VERIFIER)
                    .formParam("redirect_uri", REDIRECT_URI)
                    .formParam("client_id", CLIENT_ID)
                    .when()
                    .post("/oauth/token")
                    .then()
                    .statusCode(200)
                    .header("Cache-Control", "no-store")
                    .body("token_type", is("Bearer"))
                    .body("expires_in", is(3600))
                    .body("access_token", notNullValue())
                    .body("refresh_token", notNullValue())
                    .body("scope", containsString("conduit:mcp:datasource:read"));
        }

        @Test
        @DisplayName("should accept a JSON token request")
        void shouldAcceptJson() {
            given().contentType(ContentType.JSON)
                    .body("{\"grant_type\":\"authorization_code\",\"code\":\""
                            + OAuthTestClient.authorizationCode(null) + "\",\"code_verifier\":\"" + VERIFIER
                            + "\",\"redirect_uri\":\"" + REDIRECT_URI + "\",\"client_id\":\"" + CLIENT_ID + "\"}")
                    .when()
                    .post("/oauth/token")
                    .then()
                    .statusCode(200)
                    .body("access_token", notNullValue());
        }

        @Test
        @DisplayName("should redeem a code only once")
        void shouldRedeemCodeOnce() {
            final var code = OAuthTestClient.authorizationCode(null);
            redeem(code).then().statusCode(200);

            redeem(code)
                    .then()
                    .statusCode(400)
                    .header("Cache-Control", "no-store")
                    .body("error", is("invalid_grant"));
        }

        @Test
        @DisplayName("should grant only the supported requested scopes")
        void shouldNarrowScopes() {
            final var tokens = OAuthTestClient.obtainTokens("conduit:mcp:datasource:read unknown:scope");

            assertEquals("conduit:mcp:datasource:read", tokens.getString("scope"));
        }

        @Test
        @DisplayName("should return the same refresh token on refresh")
        void shouldRefresh() {
            final var refreshToken = OAuthTestClient.obtainTokens(null).getString("refresh_token");

            given().contentType(ContentType.URLENC)
                    .formParam("grant_type", "refresh_token")
                    .formParam("refresh_token", refreshToken)
                    .formParam("client_id", CLIENT_ID)
                    .when()
                    .post("/oauth/token")
                    .then()
                    .statusCode(200)
                    .body("refresh_token", equalTo(refreshToken))
                    .body("access_token", notNullValue());
        }

        @Test
        @DisplayName("should reject unsupported grant types")
        void shouldRejectUnsupportedGrant() {
            given().contentType(ContentType.URLENC)
                    .formParam("grant_type", "client_credentials")
                    .when()
                    .post("/oauth/token")
                    .then()
                    .statusCode(400)
                    .body("error", is("unsupported_grant_type"));
        }

        private io.restassured.response.Response redeem(String code) {
            return given().contentType(ContentType.URLENC)
                    .formParam("grant_type", "authorization_code")
                    .formParam("code", code)
                    .formParam("code_verifier", VERIFIER)
                    .formParam("redirect_uri", REDIRECT_URI)
                    .formParam("client_id", CLIENT_ID)
                    .when()
                    .post("/oauth/token");
        }
    }

    @Nested
    @DisplayName("POST /oauth/register")
    class RegisterTests {

        @Test
        @DisplayName("should register a public client")
        void shouldRegister() {
            given().contentType(ContentType.JSON)
                    .body("{\"redirect_uris\":[\"http://localhost:3000/callback\",\"myapp://cb\"]}")
                    .when()
                    .post("/oauth/register")
                    .then()
                    .statusCode(201)
                    .body("client_id", is(CLIENT_ID))
                    .body("redirect_uris", hasItem("myapp://cb"))
                    .body("token_endpoint_auth_method", is("none"))
                    .body("grant_types", hasItem("refresh_token"));
        }

        @Test
        @DisplayName("should reject insecure redirect URIs")
        void shouldRejectInsecureRedirect() {
            given().contentType(ContentType.JSON)
                    .body("{\"redirect_uris\":[\"http://evil.example.com/cb\"]}")
                    .when()
                    .post("/oauth/register")
                    .then()
                    .statusCode(400)
                    .body("error", is("invalid_redirect_uri"))
                    .body("error_description", startsWith("Invalid redirect URI"));
        }
    }
}
