package com.docproof.ledger;

import com.docproof.audit.fingerprint.ComplianceFingerprint;
import com.docproof.audit.snapshot.ExecutionPlanSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** LedgerStore used when no ledger is configured. Logs at DEBUG so the ledger path stays visible. */
public final class NoOpLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(NoOpLedgerStore.class);

    @Override
    public void runStarted(String runId, String tenantId, ExecutionPlanSnapshot snapshot, long startTimeMillis) {
        log.debug("Ledger (no-op): runStarted | runId={} | planId={} | persistence skipped", runId,
                snapshot != null ? snapshot.getPlanId() : null);
    }

    @Override
    public void runEnded(String runId, long endTimeMillis, String status, ComplianceFingerprint fingerprint, Long durationMs) {
        log.debug("Ledger (no-op): runEnded | runId={} | status={}", runId, status);
    }
}
