package com.docproof.storage.cleanup;

import java.time.Instant;

/**
 * Cleanup problem surfaced on the report instead of being thrown.
 *
 * @param code          {@link #CLEANUP_QUEUED}, {@link #CLEANUP_PARTIAL} or {@link #CLEANUP_ERROR}
 * @param affectedCount number of temp entries concerned
 */
public record RetentionWarning(String code, String message, Instant timestamp, int affectedCount) {

    public static final String CLEANUP_QUEUED = "CLEANUP_QUEUED";
    public static final String CLEANUP_PARTIAL = "CLEANUP_PARTIAL";
    public static final String CLEANUP_ERROR = "CLEANUP_ERROR";
}
