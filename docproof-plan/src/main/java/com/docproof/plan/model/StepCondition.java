package com.docproof.plan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Guard evaluated before a step is dispatched. Which field is meaningful depends on {@link #getType()}:
 * {@code filterId} for filter-passed/filter-failed, {@code fieldPath} (dotted) for field-exists,
 * {@code expression} for custom.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StepCondition {

    private final ConditionType type;
    private final String filterId;
    private final String fieldPath;
    private final String expression;

    @JsonCreator
    public StepCondition(
            @JsonProperty("type") ConditionType type,
            @JsonProperty("filterId") String filterId,
            @JsonProperty("fieldPath") String fieldPath,
            @JsonProperty("expression") String expression) {
        this.type = type;
        this.filterId = filterId;
        this.fieldPath = fieldPath;
        this.expression = expression;
    }

    public static StepCondition filterPassed(String filterId) {
        return new StepCondition(ConditionType.FILTER_PASSED, filterId, null, null);
    }

    public static StepCondition filterFailed(String filterId) {
        return new StepCondition(ConditionType.FILTER_FAILED, filterId, null, null);
    }

    public static StepCondition fieldExists(String fieldPath) {
        return new StepCondition(ConditionType.FIELD_EXISTS, null, fieldPath, null);
    }

    public static StepCondition custom(String expression) {
        return new StepCondition(ConditionType.CUSTOM, null, null, expression);
    }

    public ConditionType getType() {
        return type;
    }

    public String getFilterId() {
        return filterId;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepCondition that = (StepCondition) o;
        return type == that.type && Objects.equals(filterId, that.filterId)
                && Objects.equals(fieldPath, that.fieldPath) && Objects.equals(expression, that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, filterId, fieldPath, expression);
    }

    @Override
    public String toString() {
        return "StepCondition{" + (type != null ? type.toValue() : "null") + "}";
    }
}
