package com.docproof.filter.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one step. {@link #FAILED} means the document did not pass the check;
 * {@link #ERROR} means the check itself could not complete (exception, timeout, missing filter).
 */
public enum StepStatus {
    PASSED,
    FAILED,
    WARNING,
    SKIPPED,
    ERROR;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static StepStatus fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        return StepStatus.valueOf(value.trim().toUpperCase());
    }

    /** True for statuses that trigger the step's failure policy. */
    public boolean isFailure() {
        return this == FAILED || this == ERROR;
    }
}
