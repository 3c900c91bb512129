package com.docproof.engine.condition;

import com.docproof.executioncontext.ValidationContext;
import com.docproof.filter.result.StepResult;
import com.docproof.filter.result.StepStatus;
import com.docproof.plan.model.StepCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Decides whether a step's condition holds against the results recorded so far.
 * <ul>
 *   <li>{@code filter-passed}: the referenced filter ran and produced no error diagnostic</li>
 *   <li>{@code filter-failed}: the referenced filter ran and failed or produced an error diagnostic</li>
 *   <li>{@code field-exists}: a dotted path resolves to a non-null value in the parsed document</li>
 *   <li>{@code custom}: delegated to a {@link CustomConditionEvaluator}; true when none is configured</li>
 * </ul>
 * A filter that was skipped or errored counts as neither passed nor failed.
 */
public final class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final CustomConditionEvaluator custom;

    public ConditionEvaluator() {
        this(null);
    }

    public ConditionEvaluator(CustomConditionEvaluator custom) {
        this.custom = custom;
    }

    /** True when the step should run. A null condition always holds. */
    public boolean evaluate(StepCondition condition, ValidationContext context) {
        if (condition == null || condition.getType() == null) {
            return true;
        }
        switch (condition.getType()) {
            case FILTER_PASSED:
                return passed(context.getStepResult(condition.getFilterId()));
            case FILTER_FAILED:
                return failed(context.getStepResult(condition.getFilterId()));
            case FIELD_EXISTS:
                return fieldExists(context.getParsedDocument(), condition.getFieldPath());
            case CUSTOM:
                return evaluateCustom(condition.getExpression(), context);
            default:
                return true;
        }
    }

    static boolean passed(StepResult result) {
        return ran(result) && result.getStatus() != StepStatus.FAILED && !result.hasErrors();
    }

    static boolean failed(StepResult result) {
        return ran(result) && (result.getStatus() == StepStatus.FAILED || result.hasErrors());
    }

    private static boolean ran(StepResult result) {
        return result != null && result.getStatus() != StepStatus.SKIPPED && result.getStatus() != StepStatus.ERROR;
    }

    /** Walks {@code a.b.c} through nested maps. */
    static boolean fieldExists(Map<String, Object> document, String path) {
        if (document == null || path == null || path.isBlank()) {
            return false;
        }
        Object current = document;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return false;
            }
            current = map.get(part);
            if (current == null) {
                return false;
            }
        }
        return true;
    }

    private boolean evaluateCustom(String expression, ValidationContext context) {
        if (custom == null) {
            log.debug("No custom condition evaluator configured (runId={}); condition holds", context.getRunId());
            return true;
        }
        try {
            return custom.evaluate(expression, context);
        } catch (Exception e) {
            log.warn("Custom condition failed to evaluate (runId={}); step is skipped. Error: {}",
                    context.getRunId(), e.getMessage(), e);
            return false;
        }
    }
}
