package com.docproof.storage;

/**
 * Per-entry options for {@link TempStore#set}. Null TTL means the store's default.
 */
public final class TempStoreOptions {

    private final Long ttlMs;
    private final String category;
    private final String correlationId;

    private TempStoreOptions(Long ttlMs, String category, String correlationId) {
        if (ttlMs != null && ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive: " + ttlMs);
        }
        this.ttlMs = ttlMs;
        this.category = category != null && !category.isBlank() ? category : TempKeys.UNKNOWN;
        this.correlationId = correlationId;
    }

    public static TempStoreOptions of(String category) {
        return new TempStoreOptions(null, category, null);
    }

    public static TempStoreOptions of(String category, Long ttlMs, String correlationId) {
        return new TempStoreOptions(ttlMs, category, correlationId);
    }

    public Long getTtlMs() {
        return ttlMs;
    }

    public String getCategory() {
        return category;
    }

    public String getCorrelationId() {
        return correlationId;
    }
}
