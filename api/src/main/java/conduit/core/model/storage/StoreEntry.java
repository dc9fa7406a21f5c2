package conduit.core.model.storage;

import java.time.Duration;
import java.time.Instant;

/**
 * A live record held by a key-value store together with its absolute expiry.
 *
 * @param value the stored value
 * @param expiresAt the instant after which the record must no longer be served
 * @param <T> the value type
 */
public record StoreEntry<T>(T value, Instant expiresAt) {

    public StoreEntry {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt cannot be null");
        }
    }

    /**
     * Check whether the entry is expired at the given instant.
     *
     * @param now the instant to check against
     * @return true if {@code now} is at or past the expiry
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Time left before the entry expires, never negative.
     *
     * @param now the current instant
     * @return remaining lifetime
     */
    public Duration remaining(Instant now) {
        final var remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
