package com.docproof.ledger;

import com.docproof.audit.fingerprint.ComplianceFingerprint;
import com.docproof.audit.snapshot.ExecutionPlanSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fail-safe facade for the run ledger. All writes delegate to {@link LedgerStore};
 * any exception from the store is caught, logged, and not rethrown so a run never fails on the ledger.
 */
public final class RunLedger {

    private static final Logger log = LoggerFactory.getLogger(RunLedger.class);

    private final LedgerStore store;

    public RunLedger(LedgerStore store) {
        this.store = store != null ? store : new NoOpLedgerStore();
    }

    /** Ledger that records nothing. */
    public static RunLedger disabled() {
        return new RunLedger(null);
    }

    public void runStarted(String runId, String tenantId, ExecutionPlanSnapshot snapshot, long startTimeMillis) {
        try {
            store.runStarted(runId, tenantId, snapshot, startTimeMillis);
        } catch (Throwable t) {
            log.warn("Ledger runStarted failed (runId={}); execution continues. Error: {}", runId, t.getMessage(), t);
        }
    }

    public void stepEnded(String runId, String filterId, String status, long durationMs) {
        try {
            store.stepEnded(runId, filterId, status, durationMs);
        } catch (Throwable t) {
            log.warn("Ledger stepEnded failed (runId={}, filterId={}); execution continues. Error: {}",
                    runId, filterId, t.getMessage(), t);
        }
    }

    public void runEnded(String runId, long endTimeMillis, String status, ComplianceFingerprint fingerprint, Long durationMs) {
        try {
            store.runEnded(runId, endTimeMillis, status, fingerprint, durationMs);
        } catch (Throwable t) {
            log.warn("Ledger runEnded failed (runId={}); execution continues. Error: {}", runId, t.getMessage(), t);
        }
    }
}
