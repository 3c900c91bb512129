package com.docproof.storage;

import java.time.Instant;

/**
 * Metadata of a stored entry. Never carries the value.
 */
public record TempStoreEntry(
        String key,
        Instant createdAt,
        Instant expiresAt,
        long ttlMs,
        String category,
        String correlationId,
        long sizeBytes) {
}
