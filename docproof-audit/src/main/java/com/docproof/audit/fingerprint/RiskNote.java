package com.docproof.audit.fingerprint;

import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.Severity;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** A warning-level or semantic finding carried into the fingerprint. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RiskNote {

    public static final String SEMANTIC_CATEGORY = "semantic";

    private final String code;
    private final String message;
    private final String severity;
    private final String category;

    @JsonCreator
    public RiskNote(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("severity") String severity,
            @JsonProperty("category") String category) {
        this.code = Objects.requireNonNull(code, "code");
        this.message = message != null ? message : "";
        this.severity = severity != null ? severity : "low";
        this.category = category;
    }

    /** True for diagnostics that become risk notes: warnings, and anything in the semantic category. */
    public static boolean isRisk(Diagnostic d) {
        return d.getSeverity() == Severity.WARNING || SEMANTIC_CATEGORY.equals(d.getCategory());
    }

    public static RiskNote from(Diagnostic d) {
        String level = d.getSeverity() == Severity.ERROR ? "high"
                : d.getSeverity() == Severity.WARNING ? "medium" : "low";
        return new RiskNote(d.getCode(), d.getMessage(), level, d.getCategory());
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /** {@code high}, {@code medium} or {@code low}. */
    public String getSeverity() {
        return severity;
    }

    public String getCategory() {
        return category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RiskNote that = (RiskNote) o;
        return code.equals(that.code) && message.equals(that.message) && severity.equals(that.severity)
                && Objects.equals(category, that.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, severity, category);
    }

    @Override
    public String toString() {
        return "RiskNote{" + code + ", " + severity + "}";
    }
}
