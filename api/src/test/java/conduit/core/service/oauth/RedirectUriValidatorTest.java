package conduit.core.service.oauth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("RedirectUriValidator")
class RedirectUriValidatorTest {

    private RedirectUriValidator validator;

    @BeforeEach
    void setUp() {
        validator = new RedirectUriValidator();
    }

    @Nested
    @DisplayName("isValid()")
    class IsValidTests {

        @ParameterizedTest
        @ValueSource(strings = {
            "https://client.example.com/callback",
            "http://localhost:3000/callback",
            "http://127.0.0.1:8976/oauth",
            "http://[::1]:8976/oauth",
            "cursor://anysphere.cursor-retrieval/oauth/callback",
            "com.example.app:/oauth2redirect"
        })
        @DisplayName("should accept https, loopback http and native schemes")
        void shouldAcceptAllowedUris(String uri) {
            assertTrue(validator.isValid(uri));
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "http://client.example.com/callback",
            "https://client.example.com/callback#fragment",
            "javascript:alert(1)",
            "data:text/html,hi",
            "file:///etc/passwd",
            "/relative/path",
            "not a uri"
        })
        @DisplayName("should reject remote http, fragments, dangerous schemes and relative URIs")
        void shouldRejectDisallowedUris(String uri) {
            assertFalse(validator.isValid(uri));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @DisplayName("should reject missing URIs")
        void shouldRejectMissing(String uri) {
            assertFalse(validator.isValid(uri));
        }
    }

    @Nested
    @DisplayName("deviceName()")
    class DeviceNameTests {

        @Test
        @DisplayName("should recognise Cursor")
        void shouldRecogniseCursor() {
            assertEquals("conduit (Cursor)", validator.deviceName("cursor://anysphere/oauth", "s"));
        }

        @Test
        @DisplayName("should recognise VS Code by redirect and state")
        void shouldRecogniseVsCode() {
            assertEquals(
                    "conduit (VS Code)",
                    validator.deviceName("https://vscode.dev/redirect", "vscode://vscode.github-authentication/did"));
        }

        @Test
        @DisplayName("should name other native schemes")
        void shouldNameOtherSchemes() {
            assertEquals("conduit (windsurf)", validator.deviceName("windsurf://callback", null));
        }

        @Test
        @DisplayName("should fall back for web redirects")
        void shouldFallBackForWeb() {
            assertEquals("conduit (Unknown agent)", validator.deviceName("https://app.example.com/cb", null));
        }
    }
}
