package com.docproof.ledger;

import com.docproof.audit.fingerprint.ComplianceFingerprint;
import com.docproof.audit.snapshot.ExecutionPlanSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One run as recorded by {@link InMemoryLedgerStore}. Step rows are appended as steps finish;
 * end fields are null until the run ends.
 */
public final class LedgerEntry {

    private final String runId;
    private final String tenantId;
    private final ExecutionPlanSnapshot snapshot;
    private final long startTimeMillis;
    private final List<StepRow> steps = new ArrayList<>();
    private Long endTimeMillis;
    private String status;
    private ComplianceFingerprint fingerprint;
    private Long durationMs;

    LedgerEntry(String runId, String tenantId, ExecutionPlanSnapshot snapshot, long startTimeMillis) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.tenantId = tenantId;
        this.snapshot = snapshot;
        this.startTimeMillis = startTimeMillis;
    }

    synchronized void end(long endTimeMillis, String status, ComplianceFingerprint fingerprint, Long durationMs) {
        this.endTimeMillis = endTimeMillis;
        this.status = status;
        this.fingerprint = fingerprint;
        this.durationMs = durationMs;
    }

    synchronized void addStep(StepRow row) {
        steps.add(row);
    }

    public String getRunId() {
        return runId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public ExecutionPlanSnapshot getSnapshot() {
        return snapshot;
    }

    public long getStartTimeMillis() {
        return startTimeMillis;
    }

    public synchronized Long getEndTimeMillis() {
        return endTimeMillis;
    }

    public synchronized String getStatus() {
        return status;
    }

    public synchronized ComplianceFingerprint getFingerprint() {
        return fingerprint;
    }

    public synchronized Long getDurationMs() {
        return durationMs;
    }

    public synchronized boolean isEnded() {
        return endTimeMillis != null;
    }

    public synchronized List<StepRow> getSteps() {
        return Collections.unmodifiableList(new ArrayList<>(steps));
    }

    @Override
    public String toString() {
        return "LedgerEntry{runId=" + runId + ", status=" + getStatus() + ", steps=" + getSteps().size() + "}";
    }

    /** A finished step. */
    public static final class StepRow {
        private final String filterId;
        private final String status;
        private final long durationMs;

        StepRow(String filterId, String status, long durationMs) {
            this.filterId = filterId;
            this.status = status;
            this.durationMs = durationMs;
        }

        public String getFilterId() {
            return filterId;
        }

        public String getStatus() {
            return status;
        }

        public long getDurationMs() {
            return durationMs;
        }
    }
}
