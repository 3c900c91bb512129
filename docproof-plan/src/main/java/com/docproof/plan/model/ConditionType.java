package com.docproof.plan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of {@link StepCondition}. JSON uses the kebab-case value. */
public enum ConditionType {
    FILTER_PASSED("filter-passed"),
    FILTER_FAILED("filter-failed"),
    FIELD_EXISTS("field-exists"),
    CUSTOM("custom");

    private final String value;

    ConditionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static ConditionType fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim();
        for (ConditionType t : values()) {
            if (t.value.equalsIgnoreCase(normalized) || t.name().equalsIgnoreCase(normalized)) return t;
        }
        throw new IllegalArgumentException("Unknown condition type: " + value);
    }
}
