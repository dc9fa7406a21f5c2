package conduit.core.port.out;

import conduit.core.model.oauth.RefreshTokenData;

/**
 * Store of refresh token state, keyed by refresh token id.
 */
public interface RefreshTokenStore extends KeyValueStore<RefreshTokenData> {}
