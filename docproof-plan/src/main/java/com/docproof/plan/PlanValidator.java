package com.docproof.plan;

import com.docproof.plan.hash.ConfigHasher;
import com.docproof.plan.model.ExecutionPlan;
import com.docproof.plan.model.ExecutionStep;
import com.docproof.plan.model.StepCondition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks run before a plan executes. All problems are collected and reported together.
 */
public final class PlanValidator {

    private PlanValidator() {
    }

    /**
     * @throws ConfigurationException listing every problem found
     */
    public static void validate(ExecutionPlan plan) {
        if (plan == null) {
            throw new ConfigurationException("plan is required");
        }
        List<String> problems = new ArrayList<>();
        if (plan.getId() == null || plan.getId().isBlank()) {
            problems.add("plan id is required");
        }
        if (!ConfigHasher.verify(plan)) {
            problems.add("plan configHash does not match plan content");
        }
        Set<String> leafIds = new HashSet<>();
        Deque<ExecutionStep> work = new ArrayDeque<>(plan.getSteps());
        while (!work.isEmpty()) {
            ExecutionStep step = work.pop();
            String id = step.getFilterId();
            if (id == null || id.isBlank()) {
                problems.add("step filterId is required");
                id = "<blank>";
            }
            if (step.getTimeoutMs() != null && step.getTimeoutMs() <= 0) {
                problems.add("step " + id + ": timeoutMs must be positive");
            }
            if (step.runsChildrenInParallel() && !step.isGroup()) {
                problems.add("step " + id + ": parallel requires children");
            }
            if (!step.isGroup() && !leafIds.add(id)) {
                problems.add("step " + id + ": duplicate filterId");
            }
            checkCondition(id, step.getCondition(), problems);
            work.addAll(step.getChildren());
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    private static void checkCondition(String stepId, StepCondition condition, List<String> problems) {
        if (condition == null) return;
        if (condition.getType() == null) {
            problems.add("step " + stepId + ": condition type is required");
            return;
        }
        switch (condition.getType()) {
            case FILTER_PASSED, FILTER_FAILED -> {
                if (isBlank(condition.getFilterId())) {
                    problems.add("step " + stepId + ": condition " + condition.getType().toValue() + " requires filterId");
                }
            }
            case FIELD_EXISTS -> {
                if (isBlank(condition.getFieldPath())) {
                    problems.add("step " + stepId + ": condition field-exists requires fieldPath");
                }
            }
            case CUSTOM -> {
                if (isBlank(condition.getExpression())) {
                    problems.add("step " + stepId + ": condition custom requires expression");
                }
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
