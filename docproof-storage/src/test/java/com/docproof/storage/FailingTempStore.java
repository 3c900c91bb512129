package com.docproof.storage;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Delegating store whose secureDelete fails for chosen keys. */
public final class FailingTempStore implements TempStore {

    private final TempStore delegate;
    private final Set<String> failingKeys = ConcurrentHashMap.newKeySet();

    public FailingTempStore(TempStore delegate) {
        this.delegate = delegate;
    }

    public void failOn(String key) {
        failingKeys.add(key);
    }

    public void recover(String key) {
        failingKeys.remove(key);
    }

    @Override
    public TempStoreEntry set(String key, Object value, TempStoreOptions options) {
        return delegate.set(key, value, options);
    }

    @Override
    public Optional<Object> get(String key) {
        return delegate.get(key);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return delegate.get(key, type);
    }

    @Override
    public boolean has(String key) {
        return delegate.has(key);
    }

    @Override
    public boolean delete(String key) {
        return delegate.delete(key);
    }

    @Override
    public boolean secureDelete(String key) {
        if (failingKeys.contains(key)) {
            throw new TempStoreException("overwrite failed");
        }
        return delegate.secureDelete(key);
    }

    @Override
    public long ttl(String key) {
        return delegate.ttl(key);
    }

    @Override
    public Optional<TempStoreEntry> extendTtl(String key, long additionalMs) {
        return delegate.extendTtl(key, additionalMs);
    }

    @Override
    public Optional<TempStoreEntry> getMetadata(String key) {
        return delegate.getMetadata(key);
    }

    @Override
    public int cleanup() {
        return delegate.cleanup();
    }

    @Override
    public TempStoreStats stats() {
        return delegate.stats();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
