package conduit.core.model.session;

import java.time.Instant;

/**
 * A live protocol session: its persisted record plus the transport bound in this process.
 *
 * <p>{@code expiresAt} is the latest instant the stored record can still exist; it is only used
 * to release transports whose record has lapsed.
 */
public record Session(SessionRecord record, ProtocolTransport transport, Instant expiresAt) {

    public String sessionId() {
        return record.sessionId();
    }

    public ClientInfo clientInfo() {
        return record.clientInfo();
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
