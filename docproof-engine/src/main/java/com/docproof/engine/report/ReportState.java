package com.docproof.engine.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How far the run got, independent of the validation verdict.
 */
public enum ReportState {
    /** Every step was dispatched or deliberately skipped by its condition. */
    COMPLETE,
    /** The run was aborted and some steps never ran. */
    INCOMPLETE,
    /** A step errored or the engine hit an internal failure. */
    ERRORED,
    /** The pipeline deadline passed. */
    TIMED_OUT;

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static ReportState fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        return ReportState.valueOf(value.trim().toUpperCase());
    }
}
