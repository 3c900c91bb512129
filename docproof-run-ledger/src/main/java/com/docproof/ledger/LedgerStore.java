package com.docproof.ledger;

import com.docproof.audit.fingerprint.ComplianceFingerprint;
import com.docproof.audit.snapshot.ExecutionPlanSnapshot;

/**
 * Write side of the run ledger: one record per run (plan snapshot at start, fingerprint at end)
 * plus one record per executed step. {@link RunLedger} wraps every call so a failing store never
 * fails a run.
 */
public interface LedgerStore {

    void runStarted(String runId, String tenantId, ExecutionPlanSnapshot snapshot, long startTimeMillis);

    void runEnded(String runId, long endTimeMillis, String status, ComplianceFingerprint fingerprint, Long durationMs);

    /** Step outcome. Stores that only keep run rows can ignore it. */
    default void stepEnded(String runId, String filterId, String status, long durationMs) {
        // run-level stores ignore step rows
    }
}
