package com.docproof.filter.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of running (or skipping) one step. Filters return one from {@code execute}; the engine
 * stamps the filter id, version and duration it observed before recording it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StepResult {

    /** Metadata key a parsing filter uses to hand the parsed document to later steps. */
    public static final String PARSED_DOCUMENT = "parsedDocument";
    /** Metadata key marking that a verifier checked against a live external service. */
    public static final String LIVE_VERIFIED = "liveVerified";
    /** Metadata key giving the reason a step was skipped. */
    public static final String SKIPPED_REASON = "skippedReason";

    private final String filterId;
    private final StepStatus status;
    private final List<Diagnostic> diagnostics;
    private final long durationMs;
    private final Map<String, Object> metadata;
    private final String filterVersion;

    @JsonCreator
    public StepResult(
            @JsonProperty("filterId") String filterId,
            @JsonProperty("status") StepStatus status,
            @JsonProperty("diagnostics") List<Diagnostic> diagnostics,
            @JsonProperty("durationMs") long durationMs,
            @JsonProperty("metadata") Map<String, Object> metadata,
            @JsonProperty("filterVersion") String filterVersion) {
        this.filterId = filterId;
        this.status = Objects.requireNonNull(status, "status");
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        this.durationMs = Math.max(0L, durationMs);
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        this.filterVersion = filterVersion;
    }

    public static StepResult passed(String filterId) {
        return new StepResult(filterId, StepStatus.PASSED, null, 0L, null, null);
    }

    public static StepResult failed(String filterId, List<Diagnostic> diagnostics) {
        return new StepResult(filterId, StepStatus.FAILED, diagnostics, 0L, null, null);
    }

    public static StepResult warning(String filterId, List<Diagnostic> diagnostics) {
        return new StepResult(filterId, StepStatus.WARNING, diagnostics, 0L, null, null);
    }

    public static StepResult skipped(String filterId, String reason, Diagnostic note) {
        Map<String, Object> md = new LinkedHashMap<>();
        md.put(SKIPPED_REASON, reason);
        return new StepResult(filterId, StepStatus.SKIPPED, note != null ? List.of(note) : null, 0L, md, null);
    }

    public static StepResult error(String filterId, Diagnostic diagnostic, long durationMs) {
        return new StepResult(filterId, StepStatus.ERROR, List.of(diagnostic), durationMs, null, null);
    }

    public static Builder builder(String filterId, StepStatus status) {
        return new Builder(filterId, status);
    }

    /**
     * Copy carrying the identity and timing the engine observed. Diagnostics without a source get
     * {@code filterId} as their source.
     */
    public StepResult withExecution(String filterId, String filterVersion, long durationMs) {
        List<Diagnostic> sourced = new ArrayList<>(diagnostics.size());
        for (Diagnostic d : diagnostics) {
            sourced.add(d.getSource() == null ? d.withSource(filterId) : d);
        }
        return new StepResult(filterId, status, sourced, durationMs, metadata, filterVersion);
    }

    public String getFilterId() {
        return filterId;
    }

    public StepStatus getStatus() {
        return status;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getFilterVersion() {
        return filterVersion;
    }

    @JsonIgnore
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR);
    }

    @Override
    public String toString() {
        return "StepResult{" + filterId + "=" + status.toValue() + ", diagnostics=" + diagnostics.size() + "}";
    }

    public static final class Builder {
        private final String filterId;
        private final StepStatus status;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String filterId, StepStatus status) {
            this.filterId = filterId;
            this.status = status;
        }

        public Builder diagnostic(Diagnostic diagnostic) {
            diagnostics.add(Objects.requireNonNull(diagnostic, "diagnostic"));
            return this;
        }

        public Builder diagnostics(List<Diagnostic> list) {
            if (list != null) list.forEach(this::diagnostic);
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public StepResult build() {
            return new StepResult(filterId, status, diagnostics, 0L, metadata, null);
        }
    }
}
