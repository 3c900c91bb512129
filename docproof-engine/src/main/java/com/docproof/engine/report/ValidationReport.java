package com.docproof.engine.report;

import com.docproof.audit.fingerprint.ComplianceFingerprint;
import com.docproof.audit.fingerprint.InvoiceSummary;
import com.docproof.audit.fingerprint.ValidationStatus;
import com.docproof.audit.snapshot.ExecutionPlanSnapshot;
import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.StepResult;
import com.docproof.filter.result.StepStatus;
import com.docproof.storage.cleanup.CleanupResult;
import com.docproof.storage.cleanup.RetentionWarning;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one pipeline run. Immutable; serialize with {@link ReportJson}.
 * <p>
 * Carries no document content: the invoice summary is masked and the parsed document is never included.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ValidationReport {

    private final String runId;
    private final String correlationId;
    private final ReportState reportState;
    private final ValidationStatus status;
    private final int score;
    private final List<Diagnostic> diagnostics;
    private final DiagnosticCounts diagnosticCounts;
    private final List<StepResult> steps;
    private final StepStatistics stepStatistics;
    private final InvoiceSummary invoiceSummary;
    private final ExecutionPlanSnapshot planSnapshot;
    private final Map<String, String> stepConfigHashes;
    private final ComplianceFingerprint fingerprint;
    private final Timing timing;
    private final Map<String, Object> metadata;
    private final String abortReason;
    private final String appliedRetentionPolicy;
    private final List<RetentionWarning> retentionWarnings;
    private final CleanupResult cleanup;

    private ValidationReport(Builder b) {
        this.runId = Objects.requireNonNull(b.runId, "runId");
        this.correlationId = b.correlationId;
        this.reportState = Objects.requireNonNull(b.reportState, "reportState");
        this.status = Objects.requireNonNull(b.status, "status");
        this.score = b.score;
        this.diagnostics = List.copyOf(b.diagnostics);
        this.diagnosticCounts = DiagnosticCounts.of(this.diagnostics);
        this.steps = List.copyOf(b.steps);
        this.stepStatistics = StepStatistics.of(this.steps);
        this.invoiceSummary = b.invoiceSummary != null ? b.invoiceSummary : InvoiceSummary.EMPTY;
        this.planSnapshot = b.planSnapshot;
        this.stepConfigHashes = Map.copyOf(b.stepConfigHashes);
        this.fingerprint = b.fingerprint;
        this.timing = Objects.requireNonNull(b.timing, "timing");
        this.metadata = b.metadata != null ? new LinkedHashMap<>(b.metadata) : Map.of();
        this.abortReason = b.abortReason;
        this.cleanup = b.cleanup;
        this.appliedRetentionPolicy = b.cleanup != null ? b.cleanup.policy() : null;
        this.retentionWarnings = b.cleanup != null ? b.cleanup.warnings() : List.of();
    }

    public static Builder builder(String runId) {
        return new Builder(runId);
    }

    public String getRunId() {
        return runId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public ReportState getReportState() {
        return reportState;
    }

    public ValidationStatus getStatus() {
        return status;
    }

    /** 0..100. */
    public int getScore() {
        return score;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public DiagnosticCounts getDiagnosticCounts() {
        return diagnosticCounts;
    }

    /** Recorded step results in completion order. */
    public List<StepResult> getSteps() {
        return steps;
    }

    public StepStatistics getStepStatistics() {
        return stepStatistics;
    }

    public InvoiceSummary getInvoiceSummary() {
        return invoiceSummary;
    }

    public ExecutionPlanSnapshot getPlanSnapshot() {
        return planSnapshot;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, String> getStepConfigHashes() {
        return stepConfigHashes;
    }

    public ComplianceFingerprint getFingerprint() {
        return fingerprint;
    }

    public Timing getTiming() {
        return timing;
    }

    /** Caller request metadata, echoed back. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getAbortReason() {
        return abortReason;
    }

    public String getAppliedRetentionPolicy() {
        return appliedRetentionPolicy;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<RetentionWarning> getRetentionWarnings() {
        return retentionWarnings;
    }

    @JsonIgnore
    public CleanupResult getCleanup() {
        return cleanup;
    }

    /** Latest result for the filter id, or null when the step was never recorded. */
    public StepResult step(String filterId) {
        for (int i = steps.size() - 1; i >= 0; i--) {
            if (Objects.equals(steps.get(i).getFilterId(), filterId)) {
                return steps.get(i);
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "ValidationReport{runId=" + runId + ", state=" + reportState + ", status=" + status
                + ", score=" + score + ", steps=" + steps.size() + "}";
    }

    public static final class DiagnosticCounts {
        private final int errors;
        private final int warnings;
        private final int info;
        private final int hints;

        DiagnosticCounts(int errors, int warnings, int info, int hints) {
            this.errors = errors;
            this.warnings = warnings;
            this.info = info;
            this.hints = hints;
        }

        static DiagnosticCounts of(Collection<Diagnostic> diagnostics) {
            int e = 0, w = 0, i = 0, h = 0;
            for (Diagnostic d : diagnostics) {
                if (d.getSeverity() == null) continue;
                switch (d.getSeverity()) {
                    case ERROR: e++; break;
                    case WARNING: w++; break;
                    case INFO: i++; break;
                    case HINT: h++; break;
                    default: break;
                }
            }
            return new DiagnosticCounts(e, w, i, h);
        }

        public int getErrors() {
            return errors;
        }

        public int getWarnings() {
            return warnings;
        }

        public int getInfo() {
            return info;
        }

        public int getHints() {
            return hints;
        }
    }

    /** {@code ran} counts steps whose filter returned a verdict (passed, warning or failed). */
    public static final class StepStatistics {
        private final int total;
        private final int ran;
        private final int skipped;
        private final int errored;
        private final long totalDurationMs;

        StepStatistics(int total, int ran, int skipped, int errored, long totalDurationMs) {
            this.total = total;
            this.ran = ran;
            this.skipped = skipped;
            this.errored = errored;
            this.totalDurationMs = totalDurationMs;
        }

        static StepStatistics of(Collection<StepResult> steps) {
            int ran = 0, skipped = 0, errored = 0;
            long duration = 0L;
            for (StepResult s : steps) {
                if (s.getStatus() == StepStatus.SKIPPED) {
                    skipped++;
                } else if (s.getStatus() == StepStatus.ERROR) {
                    errored++;
                } else {
                    ran++;
                }
                duration += s.getDurationMs();
            }
            return new StepStatistics(steps.size(), ran, skipped, errored, duration);
        }

        public int getTotal() {
            return total;
        }

        public int getRan() {
            return ran;
        }

        public int getSkipped() {
            return skipped;
        }

        public int getErrored() {
            return errored;
        }

        public long getTotalDurationMs() {
            return totalDurationMs;
        }
    }

    public static final class Timing {
        private final Instant startedAt;
        private final Instant completedAt;
        private final long durationMs;

        public Timing(Instant startedAt, Instant completedAt) {
            this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
            this.completedAt = Objects.requireNonNull(completedAt, "completedAt");
            this.durationMs = Math.max(0L, completedAt.toEpochMilli() - startedAt.toEpochMilli());
        }

        public Instant getStartedAt() {
            return startedAt;
        }

        public Instant getCompletedAt() {
            return completedAt;
        }

        public long getDurationMs() {
            return durationMs;
        }
    }

    public static final class Builder {
        private final String runId;
        private String correlationId;
        private ReportState reportState;
        private ValidationStatus status;
        private int score;
        private List<Diagnostic> diagnostics = List.of();
        private List<StepResult> steps = List.of();
        private InvoiceSummary invoiceSummary;
        private ExecutionPlanSnapshot planSnapshot;
        private Map<String, String> stepConfigHashes = Map.of();
        private ComplianceFingerprint fingerprint;
        private Timing timing;
        private Map<String, Object> metadata;
        private String abortReason;
        private CleanupResult cleanup;

        private Builder(String runId) {
            this.runId = runId;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder reportState(ReportState reportState) {
            this.reportState = reportState;
            return this;
        }

        public Builder status(ValidationStatus status) {
            this.status = status;
            return this;
        }

        public Builder score(int score) {
            this.score = score;
            return this;
        }

        public Builder diagnostics(List<Diagnostic> diagnostics) {
            this.diagnostics = diagnostics != null ? diagnostics : List.of();
            return this;
        }

        public Builder steps(List<StepResult> steps) {
            this.steps = steps != null ? steps : List.of();
            return this;
        }

        public Builder invoiceSummary(InvoiceSummary invoiceSummary) {
            this.invoiceSummary = invoiceSummary;
            return this;
        }

        public Builder planSnapshot(ExecutionPlanSnapshot planSnapshot) {
            this.planSnapshot = planSnapshot;
            return this;
        }

        public Builder stepConfigHashes(Map<String, String> stepConfigHashes) {
            this.stepConfigHashes = stepConfigHashes != null ? stepConfigHashes : Map.of();
            return this;
        }

        public Builder fingerprint(ComplianceFingerprint fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public Builder timing(Timing timing) {
            this.timing = timing;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder abortReason(String abortReason) {
            this.abortReason = abortReason;
            return this;
        }

        public Builder cleanup(CleanupResult cleanup) {
            this.cleanup = cleanup;
            return this;
        }

        public ValidationReport build() {
            return new ValidationReport(this);
        }
    }
}
