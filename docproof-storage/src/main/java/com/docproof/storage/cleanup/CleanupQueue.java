package com.docproof.storage.cleanup;

import com.docproof.storage.TempStore;

import java.util.List;

/**
 * Retry ledger for temp-store keys whose deletion failed.
 * <p>
 * Invariants: a key appears at most once among pending records; re-enqueueing a pending key replaces the
 * record with {@code retryCount} increased by exactly one; a record whose retry count reaches its
 * maximum is abandoned and never retried or re-queued again.
 */
public interface CleanupQueue {

    /**
     * Adds a failure, or bumps the retry count of the pending record for the same key.
     */
    EnqueueOutcome enqueue(FailedDeleteRecord record);

    /** Pending records in enqueue order. */
    List<FailedDeleteRecord> getPending();

    int size();

    /** Drops the pending record for the key (deletion succeeded or entry is gone). */
    void markCompleted(String key);

    /** Abandons the pending record for the key. */
    void markFailed(String key, String reason);

    /**
     * Retries every pending record once against the store. Never throws for a single record's failure.
     */
    CleanupQueueResult process(TempStore store);

    List<FailedDeleteRecord> getAbandoned();

    /** Abandoned keys, for alerting and manual follow-up. Sensitive: do not log. */
    List<String> getAbandonedKeys();
}
