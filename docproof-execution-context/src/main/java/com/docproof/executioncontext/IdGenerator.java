package com.docproof.executioncontext;

/**
 * Source of unique identifiers (run ids, fingerprint ids). Injected so runs can be replayed with
 * predictable ids.
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * @param prefix short type prefix (e.g. {@code run})
     * @return a new id that starts with {@code prefix}
     */
    String newId(String prefix);
}
