package com.docproof.storage.cleanup;

import java.util.List;

/**
 * Outcome of cleaning up one run's temp entries.
 *
 * @param completed  true when the cleanup pass itself ran to the end (entries may still be queued)
 * @param deleted    entries overwritten and removed
 * @param missing    tracked entries already gone (expired or removed earlier)
 * @param queued     entries whose deletion failed and were queued for retry
 * @param unresolved entries whose deletion failed and could not be queued either
 * @param policy     retention policy applied, e.g. {@code zero-retention}
 */
public record CleanupResult(
        boolean completed,
        int deleted,
        int missing,
        int queued,
        int unresolved,
        long durationMs,
        List<RetentionWarning> warnings,
        String policy) {

    public CleanupResult {
        warnings = List.copyOf(warnings);
    }

    /** True when every tracked entry is gone now. */
    public boolean isClean() {
        return completed && queued == 0 && unresolved == 0;
    }
}
