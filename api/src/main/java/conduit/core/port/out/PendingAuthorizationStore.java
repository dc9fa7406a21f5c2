package conduit.core.port.out;

import conduit.core.model.oauth.PendingAuthorization;

/**
 * Store of pending authorization requests, keyed by authorization key.
 */
public interface PendingAuthorizationStore extends KeyValueStore<PendingAuthorization> {}
