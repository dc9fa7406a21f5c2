package conduit.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import conduit.MutableClock;
import conduit.adapter.out.storage.Stores;
import conduit.adapter.out.storage.memory.MemoryStore;
import conduit.core.config.SessionConfig;
import conduit.core.model.auth.AuthContext;
import conduit.core.model.oauth.AccessTokenClaims;
import conduit.core.model.oauth.Tokens;
import conduit.core.model.session.ClientInfo;
import conduit.core.model.session.SessionException;
import conduit.core.model.session.SessionRecord;
import conduit.core.port.out.SessionStore;
import conduit.core.service.scope.ScopeRegistry;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionManager")
class SessionManagerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final AuthContext AUTH = auth("alice", "mcp-public-client");

    private static final String INITIALIZE = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
            + "\"params\":{\"protocolVersion\":\"2025-06-18\",\"clientInfo\":{\"name\":\"inspector\",\"version\":\"0.9\"}}}";
    private static final String PING = "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"ping\"}";

    @Mock
    private SessionConfig config;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private MemoryStore<SessionRecord> backing;
    private SessionStore store;
    private JsonRpcTransportFactory transports;
    private SessionManager manager;

    @BeforeEach
    void setUp() {
        lenient().when(config.ttl()).thenReturn(Duration.ofHours(24));
        lenient().when(config.maxIdAttempts()).thenReturn(3);
        clock = MutableClock.startingNow();
        backing = new MemoryStore<>("sessions", clock);
        store = Stores.sessions(backing);
        transports = new JsonRpcTransportFactory(Map.of(), new ScopeRegistry(true, false), objectMapper, "test");
        manager = new SessionManager(store, transports, config, clock, objectMapper);
    }

    private static AuthContext auth(String subject, String clientId) {
        return new AuthContext(new AccessTokenClaims(
                "jti-" + subject,
                subject,
                clientId,
                Set.of(),
                "https://up",
                "user-" + subject,
                new Tokens("upstream-access", null, 3600, NOW),
                NOW,
                NOW.plusSeconds(3600)));
    }

    private String initialize() {
        return manager.handle(null, INITIALIZE, AUTH).await().indefinitely().sessionId();
    }

    @Nested
    @DisplayName("handle() without a session id")
    class NewSessionTests {

        @Test
        @DisplayName("should open a session on initialize and persist its record")
        void shouldCreateSessionOnInitialize() {
            final var response = manager.handle(null, INITIALIZE, AUTH).await().indefinitely();

            assertTrue(SessionManager.isValidSessionId(response.sessionId()));
            assertTrue(response.body().contains("\"protocolVersion\":\"2025-06-18\""));
            final var record = store.get(response.sessionId()).await().indefinitely();
            assertEquals(new ClientInfo("inspector", "0.9"), record.orElseThrow().clientInfo());
            assertEquals("alice", record.orElseThrow().subject());
            assertEquals("mcp-public-client", record.orElseThrow().clientId());
            assertEquals(1, manager.activeSessions());
        }

        @Test
        @DisplayName("should record unknown client details when initialize carries none")
        void shouldDefaultClientInfo() {
            final var response = manager.handle(null, "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}", AUTH)
                    .await()
                    .indefinitely();

            final var record = store.get(response.sessionId()).await().indefinitely();
            assertEquals(ClientInfo.unknown(), record.orElseThrow().clientInfo());
        }

        @Test
        @DisplayName("should give each initialize its own session")
        void shouldCreateDistinctSessions() {
            assertNotEquals(initialize(), initialize());
        }

        @Test
        @DisplayName("should reject other messages with 400")
        void shouldRejectNonInitialize() {
            final var ex = assertThrows(
                    SessionException.class,
                    () -> manager.handle(null, PING, AUTH).await().indefinitely());

            assertEquals(400, ex.getStatus());
            assertEquals("Bad Request: No valid session ID provided", ex.getMessage());
        }

        @Test
        @DisplayName("should reject an initialize sent inside a batch")
        void shouldRejectBatchedInitialize() {
            final var ex = assertThrows(
                    SessionException.class,
                    () -> manager.handle(null, "[" + INITIALIZE + "]", AUTH).await().indefinitely());

            assertEquals(400, ex.getStatus());
        }
    }

    @Nested
    @DisplayName("handle() with a session id")
    class ExistingSessionTests {

        @Test
        @DisplayName("should route messages to the existing session")
        void shouldReuseSession() {
            final var sessionId = initialize();

            final var response = manager.handle(sessionId, PING, AUTH).await().indefinitely();

            assertEquals(sessionId, response.sessionId());
            assertTrue(response.body().contains("\"result\":{}"));
            assertEquals(1, manager.activeSessions());
        }

        @Test
        @DisplayName("should answer notifications with an empty body")
        void shouldReturnEmptyBodyForNotifications() {
            final var sessionId = initialize();

            final var response = manager.handle(
                            sessionId, "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}", AUTH)
                    .await()
                    .indefinitely();

            assertFalse(response.hasBody());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "has space", "tab\tid", "café"})
        @DisplayName("should reject malformed ids with 400")
        void shouldRejectInvalidIds(String sessionId) {
            final var ex = assertThrows(
                    SessionException.class,
                    () -> manager.handle(sessionId, PING, AUTH).await().indefinitely());

            assertEquals(400, ex.getStatus());
            assertEquals("Bad Request: Invalid session ID", ex.getMessage());
        }

        @Test
        @DisplayName("should reject unknown ids with 404")
        void shouldRejectUnknownIds() {
            final var ex = assertThrows(
                    SessionException.class,
                    () -> manager.handle("no-such-session", PING, AUTH).await().indefinitely());

            assertEquals(404, ex.getStatus());
            assertEquals("Session not found", ex.getMessage());
        }

        @Test
        @DisplayName("should resume a session known only from its stored record")
        void shouldResumeFromStoredRecord() {
            final var sessionId = initialize();
            final var otherInstance = new SessionManager(store, transports, config, clock, objectMapper);

            final var response = otherInstance.handle(sessionId, PING, AUTH).await().indefinitely();

            assertEquals(sessionId, response.sessionId());
            assertEquals(1, otherInstance.activeSessions());
        }
    }

    @Nested
    @DisplayName("stale sessions")
    class StaleSessionTests {

        @BeforeEach
        void shortTtl() {
            lenient().when(config.ttl()).thenReturn(Duration.ofHours(1));
        }

        @Test
        @DisplayName("should not serve a live session once its record has expired")
        void shouldRejectExpiredLiveSession() {
            final var sessionId = initialize();
            clock.advance(Duration.ofHours(2));

            final var ex = assertThrows(
                    SessionException.class,
                    () -> manager.handle(sessionId, PING, AUTH).await().indefinitely());

            assertEquals(404, ex.getStatus());
            assertEquals(0, manager.activeSessions());
        }

        @Test
        @DisplayName("should release the transport of a session deleted by another instance")
        void shouldReleaseSessionTerminatedElsewhere() {
            final var sessionId = initialize();
            final var otherInstance = new SessionManager(store, transports, config, clock, objectMapper);
            otherInstance.terminate(sessionId, AUTH).await().indefinitely();

            assertThrows(SessionException.class, () -> manager.require(sessionId, AUTH).await().indefinitely());
            assertEquals(0, manager.activeSessions());
        }

        @Test
        @DisplayName("should release abandoned sessions when a new one opens")
        void shouldReleaseAbandonedSessions() {
            initialize();
            initialize();
            clock.advance(Duration.ofHours(2));

            initialize();

            assertEquals(1, manager.activeSessions());
        }
    }

    @Nested
    @DisplayName("ownership")
    class OwnershipTests {

        @Test
        @DisplayName("should hide a session from another subject")
        void shouldHideSessionFromOtherSubject() {
            final var sessionId = initialize();
            final var mallory = auth("mallory", "mcp-public-client");

            final var ex = assertThrows(
                    SessionException.class,
                    () -> manager.handle(sessionId, PING, mallory).await().indefinitely());

            assertEquals(404, ex.getStatus());
            assertEquals(1, manager.activeSessions());
        }

        @Test
        @DisplayName("should hide a session from another client of the same subject")
        void shouldHideSessionFromOtherClient() {
            final var sessionId = initialize();

            final var ex = assertThrows(
                    SessionException.class,
                    () -> manager.require(sessionId, auth("alice", "other-client")).await().indefinitely());

            assertEquals(404, ex.getStatus());
        }

        @Test
        @DisplayName("should not let another subject terminate the session")
        void shouldNotLetOtherSubjectTerminate() {
            final var sessionId = initialize();

            assertThrows(
                    SessionException.class,
                    () -> manager.terminate(sessionId, auth("mallory", "mcp-public-client"))
                            .await()
                            .indefinitely());

            assertTrue(store.exists(sessionId).await().indefinitely());
            assertTrue(manager.handle(sessionId, PING, AUTH).await().indefinitely().hasBody());
        }

        @Test
        @DisplayName("should hide a resumed session from another subject")
        void shouldHideResumedSessionFromOtherSubject() {
            final var sessionId = initialize();
            final var otherInstance = new SessionManager(store, transports, config, clock, objectMapper);

            assertThrows(
                    SessionException.class,
                    () -> otherInstance.handle(sessionId, PING, auth("mallory", "mcp-public-client"))
                            .await()
                            .indefinitely());
            assertEquals(0, otherInstance.activeSessions());
        }
    }

    @Nested
    @DisplayName("terminate()")
    class TerminateTests {

        @Test
        @DisplayName("should close the transport and delete the record")
        void shouldDeleteSession() {
            final var sessionId = initialize();

            manager.terminate(sessionId, AUTH).await().indefinitely();

            assertFalse(store.exists(sessionId).await().indefinitely());
            assertEquals(0, manager.activeSessions());
            final var ex = assertThrows(
                    SessionException.class,
                    () -> manager.handle(sessionId, PING, AUTH).await().indefinitely());
            assertEquals(404, ex.getStatus());
        }

        @Test
        @DisplayName("should report unknown sessions as not found")
        void shouldRejectUnknownSession() {
            final var ex = assertThrows(
                    SessionException.class,
                    () -> manager.terminate("gone", AUTH).await().indefinitely());

            assertEquals(404, ex.getStatus());
        }
    }

    @Nested
    @DisplayName("require()")
    class RequireTests {

        @Test
        @DisplayName("should accept a live session")
        void shouldAcceptLiveSession() {
            final var sessionId = initialize();

            manager.require(sessionId, AUTH).await().indefinitely();

            assertEquals(1, manager.activeSessions());
        }
    }

    @Nested
    @DisplayName("session id allocation")
    class AllocationTests {

        @Test
        @DisplayName("should fail once every candidate id collides")
        void shouldGiveUpAfterCollisions(@Mock SessionStore collidingStore) {
            when(collidingStore.exists(anyString())).thenReturn(Uni.createFrom().item(true));
            final var colliding = new SessionManager(collidingStore, transports, config, clock, objectMapper);

            final var ex = assertThrows(
                    IllegalStateException.class,
                    () -> colliding.create(ClientInfo.unknown(), AUTH).await().indefinitely());

            assertEquals("Unable to allocate a unique session id", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("isValidSessionId()")
    class ValidationTests {

        @Test
        @DisplayName("should accept visible ASCII")
        void shouldAcceptVisibleAscii() {
            assertTrue(SessionManager.isValidSessionId("3f2b9c1e-aa01-4c5d-9e7f-0123456789ab"));
            assertTrue(SessionManager.isValidSessionId("!~"));
        }

        @Test
        @DisplayName("should reject null")
        void shouldRejectNull() {
            assertFalse(SessionManager.isValidSessionId(null));
        }
    }
}
