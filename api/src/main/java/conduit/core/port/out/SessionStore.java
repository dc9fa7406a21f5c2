package conduit.core.port.out;

import conduit.core.model.session.SessionRecord;

/**
 * Store of protocol session records, keyed by session id.
 */
public interface SessionStore extends KeyValueStore<SessionRecord> {}
