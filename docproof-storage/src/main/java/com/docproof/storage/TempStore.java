package com.docproof.storage;

import java.util.Optional;

/**
 * Short-lived storage for document data that exists only while a run needs it.
 * <p>
 * Every entry has a TTL. An expired entry is never returned by any read: reads treat it as absent and
 * remove it (overwriting it first when its category is sensitive). {@link #secureDelete} must overwrite
 * the stored bytes before removal; backends that cannot overwrite must throw {@link TempStoreException}
 * rather than silently removing.
 * <p>
 * Every operation throws {@link IllegalStateException} after {@link #close()}.
 */
public interface TempStore extends AutoCloseable {

    /**
     * Stores a value, replacing any existing entry under the key.
     *
     * @param value Jackson-serializable value
     * @return metadata of the stored entry
     */
    TempStoreEntry set(String key, Object value, TempStoreOptions options);

    /** Value decoded as maps, lists, strings, numbers and booleans; empty when absent or expired. */
    Optional<Object> get(String key);

    <T> Optional<T> get(String key, Class<T> type);

    boolean has(String key);

    /** Plain removal. Returns false when the key was absent. */
    boolean delete(String key);

    /**
     * Overwrites then removes the entry.
     *
     * @return true when an entry was removed, false when none existed
     * @throws TempStoreException when the overwrite or removal failed
     */
    boolean secureDelete(String key);

    /** Remaining lifetime in milliseconds, or -1 when absent or expired. */
    long ttl(String key);

    /**
     * Pushes the expiry of a live entry out by {@code additionalMs}.
     *
     * @return new expiry metadata, empty when absent or expired
     */
    Optional<TempStoreEntry> extendTtl(String key, long additionalMs);

    /** Entry metadata without the value; empty when absent or expired. */
    Optional<TempStoreEntry> getMetadata(String key);

    /** Removes every expired entry. Returns how many were removed. */
    int cleanup();

    TempStoreStats stats();

    /** Overwrites and drops all entries and stops background work. Idempotent. */
    @Override
    void close();
}
