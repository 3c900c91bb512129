package com.docproof.engine.condition;

import com.docproof.executioncontext.ValidationContext;

/**
 * Evaluates {@code custom} step conditions. The expression language is up to the implementation.
 */
@FunctionalInterface
public interface CustomConditionEvaluator {

    /**
     * @param expression the condition's expression text
     * @param context    the running validation
     * @return true when the step should run
     * @throws Exception when the expression cannot be evaluated; the step is then skipped
     */
    boolean evaluate(String expression, ValidationContext context) throws Exception;
}
