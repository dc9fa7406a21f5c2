package conduit.core.port.out;

import conduit.core.model.oauth.AuthorizationCode;

/**
 * Store of single-use authorization codes, keyed by code.
 */
public interface AuthorizationCodeStore extends KeyValueStore<AuthorizationCode> {}
