package conduit.adapter.out.storage;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import conduit.core.model.storage.StoreEntry;
import conduit.core.port.out.KeyValueStore;

/**
 * Base for the typed store façades: forwards every operation to the backing store.
 *
 * @param <T> the value type
 */
abstract class ForwardingKeyValueStore<T> implements KeyValueStore<T> {

    private final KeyValueStore<T> delegate;

    ForwardingKeyValueStore(KeyValueStore<T> delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    KeyValueStore<T> delegate() {
        return delegate;
    }

    @Override
    public Uni<Optional<T>> get(String key) {
        return delegate.get(key);
    }

    @Override
    public Uni<Void> set(String key, T value, Duration ttl) {
        return delegate.set(key, value, ttl);
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return delegate.delete(key);
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return delegate.exists(key);
    }

    @Override
    public Uni<Void> connect() {
        return delegate.connect();
    }

    @Override
    public Uni<Boolean> healthCheck() {
        return delegate.healthCheck();
    }

    @Override
    public Uni<Void> close() {
        return delegate.close();
    }

    @Override
    public boolean tracksExpiry() {
        return delegate.tracksExpiry();
    }

    @Override
    public Uni<Optional<StoreEntry<T>>> getEntry(String key) {
        return delegate.getEntry(key);
    }

    @Override
    public Uni<Optional<T>> consume(String key) {
        return delegate.consume(key);
    }
}
