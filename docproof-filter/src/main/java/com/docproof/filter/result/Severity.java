package com.docproof.filter.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Diagnostic severity. JSON uses the lower-case name. */
public enum Severity {
    ERROR,
    WARNING,
    INFO,
    HINT;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        return Severity.valueOf(value.trim().toUpperCase());
    }
}
