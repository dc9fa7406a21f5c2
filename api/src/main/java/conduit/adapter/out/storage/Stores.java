package conduit.adapter.out.storage;

import conduit.core.model.oauth.AuthorizationCode;
import conduit.core.model.oauth.PendingAuthorization;
import conduit.core.model.oauth.RefreshTokenData;
import conduit.core.model.session.SessionRecord;
import conduit.core.port.out.AuthorizationCodeStore;
import conduit.core.port.out.KeyValueStore;
import conduit.core.port.out.PendingAuthorizationStore;
import conduit.core.port.out.RefreshTokenStore;
import conduit.core.port.out.SessionStore;

/**
 * Typed façades over a generic {@link KeyValueStore}.
 */
public final class Stores {

    private Stores() {
        // Utility class - prevent instantiation
    }

    public static PendingAuthorizationStore pendingAuthorizations(KeyValueStore<PendingAuthorization> store) {
        return new PendingAuthorizations(store);
    }

    public static AuthorizationCodeStore authorizationCodes(KeyValueStore<AuthorizationCode> store) {
        return new AuthorizationCodes(store);
    }

    public static RefreshTokenStore refreshTokens(KeyValueStore<RefreshTokenData> store) {
        return new RefreshTokens(store);
    }

    public static SessionStore sessions(KeyValueStore<SessionRecord> store) {
        return new Sessions(store);
    }

    private static final class PendingAuthorizations extends ForwardingKeyValueStore<PendingAuthorization>
            implements PendingAuthorizationStore {
        PendingAuthorizations(KeyValueStore<PendingAuthorization> delegate) {
            super(delegate);
        }
    }

    private static final class AuthorizationCodes extends ForwardingKeyValueStore<AuthorizationCode>
            implements AuthorizationCodeStore {
        AuthorizationCodes(KeyValueStore<AuthorizationCode> delegate) {
            super(delegate);
        }
    }

    private static final class RefreshTokens extends ForwardingKeyValueStore<RefreshTokenData>
            implements RefreshTokenStore {
        RefreshTokens(KeyValueStore<RefreshTokenData> delegate) {
            super(delegate);
        }
    }

    private static final class Sessions extends ForwardingKeyValueStore<SessionRecord> implements SessionStore {
        Sessions(KeyValueStore<SessionRecord> delegate) {
            super(delegate);
        }
    }
}
