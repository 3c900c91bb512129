package com.docproof.filter.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Where in the source document a diagnostic applies. Any field may be null. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DiagnosticLocation {

    private final String path;
    private final Integer line;
    private final Integer column;

    @JsonCreator
    public DiagnosticLocation(
            @JsonProperty("path") String path,
            @JsonProperty("line") Integer line,
            @JsonProperty("column") Integer column) {
        this.path = path;
        this.line = line;
        this.column = column;
    }

    public static DiagnosticLocation ofPath(String path) {
        return new DiagnosticLocation(path, null, null);
    }

    /** XPath or dotted field path. */
    public String getPath() {
        return path;
    }

    public Integer getLine() {
        return line;
    }

    public Integer getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DiagnosticLocation that = (DiagnosticLocation) o;
        return Objects.equals(path, that.path) && Objects.equals(line, that.line) && Objects.equals(column, that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, line, column);
    }
}
