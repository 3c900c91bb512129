package com.docproof.audit.fingerprint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Long-lived attestation of one run. Holds outcomes, versions and hashes only; never document content.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ComplianceFingerprint {

    public static final String ID_PREFIX = "FL-";

    private final String id;
    private final ValidationStatus status;
    private final int score;
    private final String timestamp;
    private final Map<String, VerificationStatus> checks;
    private final List<RiskNote> riskNotes;
    private final String fingerprint;
    private final PlanReference executionPlan;
    private final String planHash;
    private final InvoiceSummary invoiceSummary;
    private final Map<String, String> filterVersions;
    private final long durationMs;

    @JsonCreator
    public ComplianceFingerprint(
            @JsonProperty("id") String id,
            @JsonProperty("status") ValidationStatus status,
            @JsonProperty("score") int score,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("checks") Map<String, VerificationStatus> checks,
            @JsonProperty("riskNotes") List<RiskNote> riskNotes,
            @JsonProperty("fingerprint") String fingerprint,
            @JsonProperty("executionPlan") PlanReference executionPlan,
            @JsonProperty("planHash") String planHash,
            @JsonProperty("invoiceSummary") InvoiceSummary invoiceSummary,
            @JsonProperty("filterVersions") Map<String, String> filterVersions,
            @JsonProperty("durationMs") long durationMs) {
        this.id = Objects.requireNonNull(id, "id");
        this.status = Objects.requireNonNull(status, "status");
        this.score = score;
        this.timestamp = timestamp;
        this.checks = checks != null ? Collections.unmodifiableMap(new LinkedHashMap<>(checks)) : Map.of();
        this.riskNotes = riskNotes != null ? List.copyOf(riskNotes) : List.of();
        this.fingerprint = fingerprint;
        this.executionPlan = executionPlan;
        this.planHash = planHash;
        this.invoiceSummary = invoiceSummary != null ? invoiceSummary : InvoiceSummary.EMPTY;
        this.filterVersions = filterVersions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(filterVersions))
                : Map.of();
        this.durationMs = durationMs;
    }

    public String getId() {
        return id;
    }

    public ValidationStatus getStatus() {
        return status;
    }

    public int getScore() {
        return score;
    }

    public String getTimestamp() {
        return timestamp;
    }

    /** Filter id → verification outcome. */
    public Map<String, VerificationStatus> getChecks() {
        return checks;
    }

    public List<RiskNote> getRiskNotes() {
        return riskNotes;
    }

    /** {@code sha256:} hash over the run's outcome; see {@link FingerprintGenerator}. */
    public String getFingerprint() {
        return fingerprint;
    }

    public PlanReference getExecutionPlan() {
        return executionPlan;
    }

    public String getPlanHash() {
        return planHash;
    }

    public InvoiceSummary getInvoiceSummary() {
        return invoiceSummary;
    }

    public Map<String, String> getFilterVersions() {
        return filterVersions;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return "ComplianceFingerprint{" + id + ", " + status + ", score=" + score + "}";
    }

    /** Identity of the executed plan. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class PlanReference {
        private final String id;
        private final String version;
        private final String configHash;

        @JsonCreator
        public PlanReference(
                @JsonProperty("id") String id,
                @JsonProperty("version") String version,
                @JsonProperty("configHash") String configHash) {
            this.id = id;
            this.version = version;
            this.configHash = configHash;
        }

        public String getId() {
            return id;
        }

        public String getVersion() {
            return version;
        }

        public String getConfigHash() {
            return configHash;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PlanReference that = (PlanReference) o;
            return Objects.equals(id, that.id) && Objects.equals(version, that.version)
                    && Objects.equals(configHash, that.configHash);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, version, configHash);
        }
    }
}
