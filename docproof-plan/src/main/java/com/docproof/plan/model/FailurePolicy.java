package com.docproof.plan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the pipeline does when a step fails (status {@code failed} or {@code error}).
 * JSON uses the snake_case value ({@code fail_fast}, {@code soft_fail}, {@code always_run}).
 */
public enum FailurePolicy {
    /** Abort the run: no further non-always_run steps are dispatched. */
    FAIL_FAST("fail_fast"),
    /** Record the failure and continue. */
    SOFT_FAIL("soft_fail"),
    /** Dispatch even after the run has been aborted. */
    ALWAYS_RUN("always_run");

    private final String value;

    FailurePolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /**
     * @param value snake_case or enum-name form; null or blank → null
     * @throws IllegalArgumentException for an unknown value
     */
    @JsonCreator
    public static FailurePolicy fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim();
        for (FailurePolicy p : values()) {
            if (p.value.equalsIgnoreCase(normalized) || p.name().equalsIgnoreCase(normalized)) return p;
        }
        throw new IllegalArgumentException("Unknown failure policy: " + value);
    }
}
