package com.docproof.ledger;

import com.docproof.audit.fingerprint.ComplianceFingerprint;
import com.docproof.audit.snapshot.ExecutionPlanSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ledger kept in process memory, for single-instance deployments and tests. Writes for an
 * unknown run id are logged and dropped.
 */
public final class InMemoryLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLedgerStore.class);

    private final Map<String, LedgerEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void runStarted(String runId, String tenantId, ExecutionPlanSnapshot snapshot, long startTimeMillis) {
        LedgerEntry previous = entries.putIfAbsent(runId, new LedgerEntry(runId, tenantId, snapshot, startTimeMillis));
        if (previous != null) {
            throw new IllegalStateException("Run already recorded: " + runId);
        }
    }

    @Override
    public void runEnded(String runId, long endTimeMillis, String status, ComplianceFingerprint fingerprint, Long durationMs) {
        LedgerEntry entry = entries.get(runId);
        if (entry == null) {
            log.warn("Ledger runEnded for unknown run {}; ignored", runId);
            return;
        }
        entry.end(endTimeMillis, status, fingerprint, durationMs);
    }

    @Override
    public void stepEnded(String runId, String filterId, String status, long durationMs) {
        LedgerEntry entry = entries.get(runId);
        if (entry == null) {
            log.warn("Ledger stepEnded for unknown run {} (filterId={}); ignored", runId, filterId);
            return;
        }
        entry.addStep(new LedgerEntry.StepRow(filterId, status, durationMs));
    }

    public Optional<LedgerEntry> find(String runId) {
        return Optional.ofNullable(entries.get(runId));
    }

    public List<LedgerEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    public int size() {
        return entries.size();
    }
}
