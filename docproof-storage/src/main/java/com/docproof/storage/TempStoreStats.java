package com.docproof.storage;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time store statistics.
 *
 * @param expiredPending entries past their expiry that no read or sweep has removed yet
 * @param lastCleanupAt  time of the last {@link TempStore#cleanup()}, or null
 */
public record TempStoreStats(
        int totalEntries,
        long totalSizeBytes,
        Map<String, Integer> byCategory,
        int expiredPending,
        Instant lastCleanupAt) {

    public TempStoreStats {
        byCategory = Map.copyOf(byCategory);
    }
}
