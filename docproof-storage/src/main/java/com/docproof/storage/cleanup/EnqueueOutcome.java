package com.docproof.storage.cleanup;

/** What {@link CleanupQueue#enqueue} did with a record. */
public enum EnqueueOutcome {
    /** Pending for a later retry. */
    QUEUED,
    /** Retries exhausted; moved to the abandoned set and alerted. */
    ABANDONED,
    /** The key was already abandoned; nothing changed. */
    IGNORED
}
