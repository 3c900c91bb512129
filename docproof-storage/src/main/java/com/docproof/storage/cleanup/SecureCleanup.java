package com.docproof.storage.cleanup;

import com.docproof.storage.TempStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Secure-deletes a set of temp keys. Every key is attempted regardless of failures on the others;
 * a failed key goes to the {@link CleanupQueue}.
 */
public final class SecureCleanup {

    private static final Logger log = LoggerFactory.getLogger(SecureCleanup.class);

    private final TempStore store;
    private final CleanupQueue queue;
    private final int maxRetries;
    private final Clock clock;

    public SecureCleanup(TempStore store, CleanupQueue queue, int maxRetries, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.queue = Objects.requireNonNull(queue, "queue");
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Per-key tallies of one pass. */
    public record Outcome(int deleted, int missing, int queued, int unresolved) {
    }

    public Outcome deleteAll(TempKeyTracker tracker, String correlationId) {
        int deleted = 0;
        int missing = 0;
        int queued = 0;
        int unresolved = 0;
        for (String key : tracker.keys()) {
            String category = tracker.categoryOf(key);
            try {
                if (store.secureDelete(key)) {
                    deleted++;
                } else {
                    missing++;
                }
                tracker.untrack(key);
            } catch (RuntimeException e) {
                log.warn("Secure delete of {} entry failed (correlationId={}): {}", category, correlationId, e.toString());
                try {
                    EnqueueOutcome outcome = queue.enqueue(FailedDeleteRecord.firstFailure(key, category,
                            clock.instant(), maxRetries, e.toString(), correlationId));
                    if (outcome == EnqueueOutcome.QUEUED) {
                        queued++;
                    } else {
                        unresolved++;
                    }
                } catch (RuntimeException queueError) {
                    unresolved++;
                    log.error("Could not queue failed delete of {} entry (correlationId={}): {}",
                            category, correlationId, queueError.toString(), queueError);
                }
            }
        }
        return new Outcome(deleted, missing, queued, unresolved);
    }
}
