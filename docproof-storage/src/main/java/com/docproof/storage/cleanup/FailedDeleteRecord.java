package com.docproof.storage.cleanup;

import java.time.Instant;
import java.util.Objects;

/**
 * A temp-store key whose deletion failed and must be retried.
 *
 * @param retryCount number of failed delete attempts so far (at least 1)
 * @param maxRetries attempts after which the key is abandoned
 */
public record FailedDeleteRecord(
        String key,
        String category,
        Instant failedAt,
        int retryCount,
        int maxRetries,
        String lastError,
        String correlationId) {

    public FailedDeleteRecord {
        Objects.requireNonNull(key, "key");
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
        }
        retryCount = Math.max(1, retryCount);
    }

    /** First failure of a key. */
    public static FailedDeleteRecord firstFailure(String key, String category, Instant failedAt, int maxRetries,
                                                  String error, String correlationId) {
        return new FailedDeleteRecord(key, category, failedAt, 1, maxRetries, error, correlationId);
    }

    FailedDeleteRecord nextFailure(FailedDeleteRecord latest) {
        return new FailedDeleteRecord(key, category, latest.failedAt, retryCount + 1, maxRetries,
                latest.lastError, correlationId != null ? correlationId : latest.correlationId);
    }

    public boolean isExhausted() {
        return retryCount >= maxRetries;
    }

    @Override
    public String toString() {
        // keys identify document data; keep them out of logs
        return "FailedDeleteRecord{category=" + category + ", retryCount=" + retryCount + "/" + maxRetries + "}";
    }
}
