package conduit.core.service.session;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import conduit.core.config.SessionConfig;
import conduit.core.model.auth.AuthContext;
import conduit.core.model.session.ClientInfo;
import conduit.core.model.session.ProtocolResponse;
import conduit.core.model.session.Session;
import conduit.core.model.session.SessionException;
import conduit.core.model.session.SessionRecord;
import conduit.core.port.in.SessionManagement;
import conduit.core.port.out.SessionStore;
import conduit.core.service.oauth.SecureTokens;

/**
 * Binds protocol sessions to transports.
 *
 * <p>Transports live in this process only. Session records are persisted so that a session
 * created by another instance, or before a restart, is resumed by binding a fresh transport
 * to the same id.
 *
 * <p>The stored record is authoritative: every request re-reads it, so a session that expired or
 * was terminated elsewhere is no longer served from this process. Sessions are only visible to
 * the subject and client that opened them; anyone else is told the session does not exist.
 */
@ApplicationScoped
public class SessionManager implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionManager.class);

    private static final Pattern SESSION_ID = Pattern.compile("^[\\x21-\\x7E]+$");

    private final SessionStore store;
    private final JsonRpcTransportFactory transports;
    private final SessionConfig config;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Map<String, Session> live = new ConcurrentHashMap<>();

    @Inject
    public SessionManager(
            SessionStore store,
            JsonRpcTransportFactory transports,
            SessionConfig config,
            Clock clock,
            ObjectMapper objectMapper) {
        this.store = store;
        this.transports = transports;
        this.config = config;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    /**
     * Whether a session id consists of visible ASCII characters only.
     */
    public static boolean isValidSessionId(String sessionId) {
        return sessionId != null && SESSION_ID.matcher(sessionId).matches();
    }

    @Override
    public Uni<ProtocolResponse> handle(String sessionId, String body, AuthContext auth) {
        if (sessionId == null) {
            final var initialize = initializeParams(body);
            if (initialize.isEmpty()) {
                return Uni.createFrom().failure(
                        SessionException.badRequest("Bad Request: No valid session ID provided"));
            }
            return create(clientInfo(initialize.get()), auth).flatMap(session -> respond(session, body, auth));
        }
        return resolve(sessionId, auth).flatMap(session -> respond(session, body, auth));
    }

    @Override
    public Uni<Void> require(String sessionId, AuthContext auth) {
        return resolve(sessionId, auth).replaceWithVoid();
    }

    @Override
    public Uni<Void> terminate(String sessionId, AuthContext auth) {
        return resolve(sessionId, auth).flatMap(session -> {
            live.remove(session.sessionId(), session);
            session.transport().close();
            return store.delete(session.sessionId());
        }).invoke(deleted -> LOG.debugf("Session %s terminated", sessionId)).replaceWithVoid();
    }

    /**
     * Number of sessions with a transport in this process.
     */
    public int activeSessions() {
        return live.size();
    }

    private Uni<ProtocolResponse> respond(Session session, String body, AuthContext auth) {
        return session.transport().handle(body, auth).map(response -> new ProtocolResponse(session.sessionId(), response));
    }

    /**
     * Open a new session with a fresh id. Ids colliding with a stored record are regenerated.
     */
    Uni<Session> create(ClientInfo clientInfo, AuthContext auth) {
        releaseExpired();
        return allocateId(config.maxIdAttempts()).flatMap(sessionId -> {
            final var record = SessionRecord.openedBy(sessionId, clientInfo, auth);
            final var expiresAt = clock.instant().plus(config.ttl());
            return store.set(sessionId, record, config.ttl()).map(ignored -> {
                final var session = bind(record, expiresAt);
                LOG.debugf("Session %s created for %s %s", sessionId, clientInfo.name(), clientInfo.version());
                return session;
            });
        });
    }

    private Uni<String> allocateId(int attemptsLeft) {
        if (attemptsLeft <= 0) {
            return Uni.createFrom().failure(new IllegalStateException("Unable to allocate a unique session id"));
        }
        final var candidate = SecureTokens.randomUuid();
        return store.exists(candidate).flatMap(taken -> {
            if (taken || live.containsKey(candidate)) {
                LOG.warnf("Session id collision, %d attempts left", attemptsLeft - 1);
                return allocateId(attemptsLeft - 1);
            }
            return Uni.createFrom().item(candidate);
        });
    }

    /**
     * Find the live session for an id, binding a new transport if only the record survives.
     */
    private Uni<Session> resolve(String sessionId, AuthContext auth) {
        if (!isValidSessionId(sessionId)) {
            return Uni.createFrom().failure(SessionException.badRequest("Bad Request: Invalid session ID"));
        }
        return store.get(sessionId).map(found -> {
            if (found.isEmpty()) {
                release(sessionId);
                throw SessionException.notFound();
            }
            final var record = found.get();
            if (!record.isOwnedBy(auth)) {
                LOG.warnf("Session %s requested by %s, which did not open it", sessionId, auth.subject());
                throw SessionException.notFound();
            }
            final var existing = live.get(sessionId);
            if (existing != null && existing.transport().isOpen()) {
                return existing;
            }
            LOG.debugf("Resuming session %s from its stored record", sessionId);
            return bind(record, clock.instant().plus(config.ttl()));
        });
    }

    /**
     * Drop the transport of a session whose record is gone.
     */
    private void release(String sessionId) {
        final var stale = live.remove(sessionId);
        if (stale != null) {
            LOG.debugf("Session %s no longer stored, closing its transport", sessionId);
            stale.transport().close();
        }
    }

    private void releaseExpired() {
        final var now = clock.instant();
        final var expired = live.values().stream().filter(session -> session.isExpiredAt(now)).toList();
        for (final var session : expired) {
            if (live.remove(session.sessionId(), session)) {
                session.transport().close();
            }
        }
        if (!expired.isEmpty()) {
            LOG.debugf("Released %d expired sessions", expired.size());
        }
    }

    private Session bind(SessionRecord record, Instant expiresAt) {
        return live.compute(record.sessionId(), (id, current) -> {
            if (current != null && current.transport().isOpen()) {
                return current;
            }
            final var session = new Session(record, transports.create(id), expiresAt);
            session.transport().onClose(() -> {
                if (live.remove(id, session)) {
                    store.delete(id).subscribe().with(
                            deleted -> LOG.debugf("Session %s record deleted on close", id),
                            failure -> LOG.warnf("Failed to delete session %s: %s", id, failure.getMessage()));
                }
            });
            return session;
        });
    }

    private Optional<JsonNode> initializeParams(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            final var root = objectMapper.readTree(body);
            if (root != null && root.isObject() && "initialize".equals(root.path("method").asText())) {
                return Optional.of(root.path("params"));
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static ClientInfo clientInfo(JsonNode params) {
        final var info = params.path("clientInfo");
        if (!info.isObject()) {
            return ClientInfo.unknown();
        }
        return new ClientInfo(info.path("name").asText("unknown"), info.path("version").asText("unknown"));
    }
}
