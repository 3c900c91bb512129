package com.docproof.storage.cleanup;

import java.util.List;

/**
 * Outcome of one {@link CleanupQueue#process} pass.
 * {@code processed == succeeded + requeued + abandoned} always holds.
 */
public record CleanupQueueResult(
        int processed,
        int succeeded,
        int requeued,
        int abandoned,
        List<String> abandonedKeys) {

    public CleanupQueueResult {
        abandonedKeys = List.copyOf(abandonedKeys);
    }
}
