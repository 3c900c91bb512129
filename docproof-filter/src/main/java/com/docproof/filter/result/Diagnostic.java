package com.docproof.filter.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single finding. Diagnostics are report data: they are returned inside {@link StepResult}s and
 * never thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Diagnostic {

    private final String code;
    private final String message;
    private final Severity severity;
    private final String category;
    private final String source;
    private final DiagnosticLocation location;
    private final Map<String, Object> context;

    @JsonCreator
    public Diagnostic(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("severity") Severity severity,
            @JsonProperty("category") String category,
            @JsonProperty("source") String source,
            @JsonProperty("location") DiagnosticLocation location,
            @JsonProperty("context") Map<String, Object> context) {
        this.code = Objects.requireNonNull(code, "code");
        this.message = message != null ? message : "";
        this.severity = severity != null ? severity : Severity.INFO;
        this.category = category;
        this.source = source;
        this.location = location;
        this.context = context != null && !context.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                : null;
    }

    public static Diagnostic error(String code, String message) {
        return new Diagnostic(code, message, Severity.ERROR, null, null, null, null);
    }

    public static Diagnostic warning(String code, String message) {
        return new Diagnostic(code, message, Severity.WARNING, null, null, null, null);
    }

    public static Diagnostic info(String code, String message) {
        return new Diagnostic(code, message, Severity.INFO, null, null, null, null);
    }

    public Diagnostic withCategory(String category) {
        return new Diagnostic(code, message, severity, category, source, location, context);
    }

    public Diagnostic withSource(String source) {
        return new Diagnostic(code, message, severity, category, source, location, context);
    }

    public Diagnostic withLocation(DiagnosticLocation location) {
        return new Diagnostic(code, message, severity, category, source, location, context);
    }

    public Diagnostic withContext(Map<String, Object> context) {
        return new Diagnostic(code, message, severity, category, source, location, context);
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getCategory() {
        return category;
    }

    /** Filter id that produced the diagnostic; the engine fills it when a filter leaves it blank. */
    public String getSource() {
        return source;
    }

    public DiagnosticLocation getLocation() {
        return location;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return code.equals(that.code) && message.equals(that.message) && severity == that.severity
                && Objects.equals(category, that.category) && Objects.equals(source, that.source)
                && Objects.equals(location, that.location) && Objects.equals(context, that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, severity, category, source, location, context);
    }

    @Override
    public String toString() {
        return severity.toValue() + ":" + code + (source != null ? "@" + source : "");
    }
}
